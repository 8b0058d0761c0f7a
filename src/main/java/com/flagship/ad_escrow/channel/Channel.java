package com.flagship.ad_escrow.channel;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A chat channel registered by its owner as an ad placement target.
 *
 * Status changes only through {@link ChannelVerifier}; every change returns a new instance.
 */
@Value
public class Channel {

    public static final int MAX_TRUST_SCORE = 100;

    UUID id;
    UUID ownerId;
    String externalId;
    String title;
    ChannelStatus status;
    int subscriberCount;
    int trustScore;
    Instant lastVerifiedAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a newly registered channel: UNVERIFIED with full trust.
     */
    public static Channel register(UUID id, UUID ownerId, String externalId, String title, Instant now) {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("External channel id is required");
        }
        return new Channel(
            id,
            ownerId,
            externalId,
            title != null && !title.isBlank() ? title : externalId,
            ChannelStatus.UNVERIFIED,
            0,
            MAX_TRUST_SCORE,
            null,
            now,
            now
        );
    }

    /**
     * Records a probe outcome. The subscriber snapshot and verification time are
     * only refreshed when the probe answered.
     *
     * @throws IllegalStateException if the status change is not allowed
     */
    public Channel applyVerification(ChannelStatus target, Integer probedSubscribers, Instant now) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move channel %s from %s to %s", id, status, target));
        }
        boolean probed = probedSubscribers != null;
        return new Channel(
            id,
            ownerId,
            externalId,
            title,
            target,
            probed ? probedSubscribers : subscriberCount,
            trustScore,
            probed ? now : lastVerifiedAt,
            createdAt,
            now
        );
    }

    /**
     * Lowers the trust score, never below zero.
     */
    public Channel penalize(int points, Instant now) {
        if (points < 0) {
            throw new IllegalArgumentException("Penalty must not be negative: " + points);
        }
        return new Channel(
            id,
            ownerId,
            externalId,
            title,
            status,
            subscriberCount,
            Math.max(0, trustScore - points),
            lastVerifiedAt,
            createdAt,
            now
        );
    }

    public boolean isVerified() {
        return status == ChannelStatus.VERIFIED;
    }

    public boolean isOwnedBy(UUID userId) {
        return ownerId.equals(userId);
    }

    /**
     * UNVERIFIED is only ever a starting point. REVOKED is reachable only from VERIFIED.
     */
    public boolean canTransitionTo(ChannelStatus target) {
        if (this.status == target) {
            return true;
        }
        return switch (target) {
            case UNVERIFIED -> false;
            case PENDING, VERIFIED -> true;
            case REVOKED -> this.status == ChannelStatus.VERIFIED;
        };
    }
}
