package com.flagship.ad_escrow.consumer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Dedup row; the event id is the primary key since one consumer group reads the campaigns topic.
 */
@Entity
@Table(name = "processed_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedEventEntity {

    @Id
    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "campaign_id", nullable = false, updatable = false)
    private UUID campaignId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "consumer_group", nullable = false, length = 100)
    private String consumerGroup;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 20)
    private ProcessedEvent.Outcome outcome;

    @Column(name = "note", columnDefinition = "TEXT")
    private String note;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    ProcessedEventEntity(ProcessedEvent event) {
        this.eventId = event.getEventId();
        this.campaignId = event.getCampaignId();
        this.eventType = event.getEventType();
        this.consumerGroup = event.getConsumerGroup();
        this.outcome = event.getOutcome();
        this.note = event.getNote();
        this.recordedAt = event.getRecordedAt();
    }

    ProcessedEvent toProcessedEvent() {
        return new ProcessedEvent(eventId, campaignId, eventType, consumerGroup, outcome, note, recordedAt);
    }
}
