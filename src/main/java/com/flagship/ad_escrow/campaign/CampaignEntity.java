package com.flagship.ad_escrow.campaign;

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

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * JPA mapping of {@link Campaign}.
 *
 * Excluded owners live in {@code campaign_exclusions} and are joined in by
 * {@link CampaignPersistenceService}; keeping them out of this entity lets the
 * row lock query stay a plain single-table {@code SELECT ... FOR UPDATE}.
 *
 * The idempotency key is a persistence concern and never reaches the domain object.
 */
@Entity
@Table(
    name = "campaigns",
    indexes = {
        @Index(name = "idx_campaigns_status_expiry", columnList = "status, expires_at"),
        @Index(name = "idx_campaigns_advertiser", columnList = "advertiser_id, created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CampaignEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "advertiser_id", nullable = false, updatable = false)
    private UUID advertiserId;

    @Column(name = "ad_content", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String adContent;

    @Column(nullable = false, updatable = false)
    private long budget;

    @Column(name = "target_duration_seconds", nullable = false, updatable = false)
    private long targetDurationSeconds;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private CampaignStatus status;

    @Column(name = "channel_id")
    private UUID channelId;

    @Column(name = "channel_owner_id")
    private UUID channelOwnerId;

    @Column(name = "placement_ref")
    private String placementRef;

    @Column(name = "posted_at")
    private Instant postedAt;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    static CampaignEntity fromDomain(Campaign campaign, String idempotencyKey) {
        return new CampaignEntity(
            campaign.getId(),
            campaign.getAdvertiserId(),
            campaign.getAdContent(),
            campaign.getBudget(),
            campaign.getTargetDuration().getSeconds(),
            campaign.getStatus(),
            campaign.getChannelId(),
            campaign.getChannelOwnerId(),
            campaign.getPlacementRef(),
            campaign.getPostedAt(),
            campaign.getFailureReason(),
            idempotencyKey,
            campaign.getCreatedAt(),
            campaign.getUpdatedAt(),
            campaign.getExpiresAt()
        );
    }

    Campaign toDomain(Set<UUID> excludedOwnerIds) {
        return Campaign.builder()
            .id(id)
            .advertiserId(advertiserId)
            .adContent(adContent)
            .budget(budget)
            .targetDuration(Duration.ofSeconds(targetDurationSeconds))
            .status(status)
            .channelId(channelId)
            .channelOwnerId(channelOwnerId)
            .placementRef(placementRef)
            .postedAt(postedAt)
            .failureReason(failureReason)
            .excludedOwnerIds(Set.copyOf(excludedOwnerIds))
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .expiresAt(expiresAt)
            .build();
    }

    /**
     * Copies the lifecycle fields. Budget, content, advertiser and deadline are fixed at creation.
     */
    void updateFromDomain(Campaign campaign) {
        this.status = campaign.getStatus();
        this.channelId = campaign.getChannelId();
        this.channelOwnerId = campaign.getChannelOwnerId();
        this.placementRef = campaign.getPlacementRef();
        this.postedAt = campaign.getPostedAt();
        this.failureReason = campaign.getFailureReason();
        this.updatedAt = campaign.getUpdatedAt();
    }
}
