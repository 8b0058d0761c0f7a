package com.flagship.ad_escrow.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class AcceptOfferRequest {

    @NotNull(message = "Channel id is required")
    @JsonProperty("channel_id")
    UUID channelId;
}
