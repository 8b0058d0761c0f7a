package com.flagship.ad_escrow.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ad_escrow.session.ConversationStep;
import com.flagship.ad_escrow.session.SessionState;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
public class SessionResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("step")
    ConversationStep step;

    @JsonProperty("attributes")
    Map<String, String> attributes;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static SessionResponse from(SessionState state) {
        return new SessionResponse(state.getUserId(), state.getStep(), state.getAttributes(), state.getUpdatedAt());
    }
}
