package com.flagship.ad_escrow.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has seen a campaign lifecycle event.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    UUID campaignId;
    String eventType;
    String consumerGroup;
    Outcome outcome;
    String note;
    Instant recordedAt;

    public enum Outcome {
        HANDLED,
        /** Not meant for this consumer; kept so a replay does not parse it again. */
        IGNORED
    }

    static ProcessedEvent handled(UUID eventId, UUID campaignId, String eventType,
                                  String consumerGroup, Instant recordedAt) {
        return new ProcessedEvent(eventId, campaignId, eventType, consumerGroup, Outcome.HANDLED, null, recordedAt);
    }

    static ProcessedEvent ignored(UUID eventId, UUID campaignId, String eventType,
                                  String consumerGroup, String reason, Instant recordedAt) {
        return new ProcessedEvent(eventId, campaignId, eventType, consumerGroup, Outcome.IGNORED, reason, recordedAt);
    }
}
