package com.flagship.ad_escrow.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A serialized campaign lifecycle event, queued for the campaigns topic.
 * The id is the lifecycle event's own id, which consumers deduplicate on.
 */
@Value
public class OutboxEvent {
    UUID id;
    UUID campaignId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int attempts;
    String lastError;
    Long sequenceNumber;

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * Left for an operator once this many sends have failed.
     */
    public boolean isDeadLettered(int maxAttempts) {
        return publishedAt == null && attempts >= maxAttempts;
    }
}
