package com.flagship.ad_escrow.channel;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of {@link Channel}.
 *
 * No setters: owner, external id and creation time are fixed after insert, the
 * rest changes only through {@link #updateFromDomain(Channel)}.
 */
@Entity
@Table(
    name = "channels",
    indexes = {
        @Index(name = "idx_channels_owner", columnList = "owner_id"),
        @Index(name = "idx_channels_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ChannelEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "external_id", nullable = false, unique = true, updatable = false)
    private String externalId;

    @Column(nullable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ChannelStatus status;

    @Column(name = "subscriber_count", nullable = false)
    private int subscriberCount;

    @Column(name = "trust_score", nullable = false)
    private int trustScore;

    @Column(name = "last_verified_at")
    private Instant lastVerifiedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static ChannelEntity fromDomain(Channel channel) {
        return new ChannelEntity(
            channel.getId(),
            channel.getOwnerId(),
            channel.getExternalId(),
            channel.getTitle(),
            channel.getStatus(),
            channel.getSubscriberCount(),
            channel.getTrustScore(),
            channel.getLastVerifiedAt(),
            channel.getCreatedAt(),
            channel.getUpdatedAt()
        );
    }

    public Channel toDomain() {
        return new Channel(
            id,
            ownerId,
            externalId,
            title,
            status,
            subscriberCount,
            trustScore,
            lastVerifiedAt,
            createdAt,
            updatedAt
        );
    }

    void updateFromDomain(Channel channel) {
        this.title = channel.getTitle();
        this.status = channel.getStatus();
        this.subscriberCount = channel.getSubscriberCount();
        this.trustScore = channel.getTrustScore();
        this.lastVerifiedAt = channel.getLastVerifiedAt();
        this.updatedAt = channel.getUpdatedAt();
    }
}
