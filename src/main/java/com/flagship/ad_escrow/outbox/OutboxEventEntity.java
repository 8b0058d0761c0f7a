package com.flagship.ad_escrow.outbox;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "outbox_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEventEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "campaign_id", nullable = false, updatable = false)
    private UUID campaignId;

    @Column(name = "event_type", nullable = false, length = 100, updatable = false)
    private String eventType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", nullable = false, columnDefinition = "jsonb", updatable = false)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    // BIGSERIAL, assigned on insert
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    OutboxEventEntity(UUID id, UUID campaignId, String eventType, String payload, Instant createdAt) {
        this.id = id;
        this.campaignId = campaignId;
        this.eventType = eventType;
        this.payload = payload;
        this.createdAt = createdAt;
    }

    OutboxEvent toOutboxEvent() {
        return new OutboxEvent(id, campaignId, eventType, payload, createdAt, publishedAt,
                attempts, lastError, sequenceNumber);
    }

    void published(Instant at) {
        publishedAt = at;
        lastError = null;
    }

    void sendFailed(String error) {
        attempts++;
        lastError = error;
    }
}
