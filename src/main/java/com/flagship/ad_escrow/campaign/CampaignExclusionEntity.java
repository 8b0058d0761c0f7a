package com.flagship.ad_escrow.campaign;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A channel owner barred from claiming one campaign again, after a failed
 * placement or a revoked channel.
 */
@Entity
@Table(
    name = "campaign_exclusions",
    uniqueConstraints = @UniqueConstraint(name = "uq_campaign_exclusions", columnNames = {"campaign_id", "owner_id"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CampaignExclusionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "campaign_id", nullable = false, updatable = false)
    private UUID campaignId;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "reason", updatable = false)
    private String reason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static CampaignExclusionEntity of(UUID campaignId, UUID ownerId, String reason, Instant now) {
        String truncated = reason != null && reason.length() > 255 ? reason.substring(0, 255) : reason;
        return new CampaignExclusionEntity(UUID.randomUUID(), campaignId, ownerId, truncated, now);
    }
}
