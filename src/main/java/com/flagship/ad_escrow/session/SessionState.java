package com.flagship.ad_escrow.session;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
public class SessionState {
    UUID userId;
    ConversationStep step;
    Map<String, String> attributes;
    Instant updatedAt;

    public static SessionState idle(UUID userId) {
        return new SessionState(userId, ConversationStep.IDLE, Map.of(), null);
    }

    public String attribute(String name) {
        return attributes.get(name);
    }
}
