package com.flagship.ad_escrow.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ad_escrow.session.ConversationStep;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.Map;

/**
 * Moves the caller's dialogue to {@code step}; attributes are merged into the stored ones.
 */
@Value
public class SessionRequest {

    @NotNull(message = "Step is required")
    @JsonProperty("step")
    ConversationStep step;

    @JsonProperty("attributes")
    Map<String, String> attributes;
}
