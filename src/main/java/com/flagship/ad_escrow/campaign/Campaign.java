package com.flagship.ad_escrow.campaign;

import com.flagship.ad_escrow.error.AlreadyClaimedException;
import com.flagship.ad_escrow.error.CampaignExpiredException;
import com.flagship.ad_escrow.error.InvalidTransitionException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Campaign domain object with an explicit lifecycle.
 *
 * <pre>
 * DRAFT -> PENDING_FUNDING -> FUNDED -> OFFERED -> ACCEPTED -> POSTED -> CONFIRMED
 *                                          ^            |          |
 *                                          +-- reoffer -+          +-> REFUNDED
 * CANCELLED: advertiser before acceptance, system from ACCEPTED
 * EXPIRED:   FUNDED, OFFERED or ACCEPTED past the deadline
 * </pre>
 *
 * Every transition validates the current state and returns a new instance; fund
 * movements that go with a transition are the state machine's job, not this class's.
 */
@Value
@Builder(toBuilder = true)
public class Campaign {

    /** Longest time an ad can be required to stay up. */
    public static final Duration MAX_TARGET_DURATION = Duration.ofDays(7);

    UUID id;
    UUID advertiserId;
    String adContent;
    long budget;
    Duration targetDuration;
    CampaignStatus status;
    UUID channelId;
    UUID channelOwnerId;
    String placementRef;
    Instant postedAt;
    String failureReason;
    Set<UUID> excludedOwnerIds;
    Instant createdAt;
    Instant updatedAt;
    Instant expiresAt;

    /**
     * Creates a campaign in DRAFT.
     */
    public static Campaign draft(UUID id, UUID advertiserId, String adContent, long budget,
                                 Duration targetDuration, Instant now, Instant expiresAt) {
        if (targetDuration == null || targetDuration.isNegative() || targetDuration.isZero()) {
            throw new IllegalArgumentException("Target duration must be positive");
        }
        if (targetDuration.compareTo(MAX_TARGET_DURATION) > 0) {
            throw new IllegalArgumentException("Target duration must not exceed " + MAX_TARGET_DURATION);
        }
        if (!expiresAt.isAfter(now)) {
            throw new IllegalArgumentException("Expiry must lie in the future");
        }
        return Campaign.builder()
            .id(id)
            .advertiserId(advertiserId)
            .adContent(adContent)
            .budget(budget)
            .targetDuration(targetDuration)
            .status(CampaignStatus.DRAFT)
            .excludedOwnerIds(Set.of())
            .createdAt(now)
            .updatedAt(now)
            .expiresAt(expiresAt)
            .build();
    }

    /**
     * DRAFT -> PENDING_FUNDING. Requires a positive budget and non-blank content.
     */
    public Campaign submit(Instant now) {
        requireStatus(CampaignStatus.DRAFT, "submit");
        if (budget <= 0) {
            throw new InvalidTransitionException("Campaign " + id + " cannot be submitted with budget " + budget);
        }
        if (adContent == null || adContent.isBlank()) {
            throw new InvalidTransitionException("Campaign " + id + " cannot be submitted without ad content");
        }
        return moveTo(CampaignStatus.PENDING_FUNDING, now).build();
    }

    /**
     * PENDING_FUNDING -> FUNDED. Only valid together with a successful escrow hold.
     */
    public Campaign fund(Instant now) {
        requireStatus(CampaignStatus.PENDING_FUNDING, "fund");
        return moveTo(CampaignStatus.FUNDED, now).build();
    }

    /**
     * FUNDED -> OFFERED.
     */
    public Campaign offer(Instant now) {
        requireStatus(CampaignStatus.FUNDED, "offer");
        return moveTo(CampaignStatus.OFFERED, now).build();
    }

    /**
     * OFFERED -> ACCEPTED, binding the claimant's channel.
     *
     * @throws AlreadyClaimedException if another owner got there first
     * @throws CampaignExpiredException if the deadline has passed
     * @throws InvalidTransitionException if the campaign is not on offer to this owner
     */
    public Campaign accept(UUID ownerId, UUID acceptedChannelId, Instant now) {
        if (status == CampaignStatus.ACCEPTED || status == CampaignStatus.POSTED || status == CampaignStatus.CONFIRMED) {
            throw new AlreadyClaimedException("Campaign " + id + " was already claimed");
        }
        requireStatus(CampaignStatus.OFFERED, "accept");
        if (isPastDeadline(now)) {
            throw new CampaignExpiredException("Campaign " + id + " expired at " + expiresAt);
        }
        if (advertiserId.equals(ownerId)) {
            throw new InvalidTransitionException("Advertiser " + ownerId + " cannot accept own campaign " + id);
        }
        if (isExcluded(ownerId)) {
            throw new InvalidTransitionException("Owner " + ownerId + " is excluded from campaign " + id);
        }
        return moveTo(CampaignStatus.ACCEPTED, now)
            .channelId(acceptedChannelId)
            .channelOwnerId(ownerId)
            .failureReason(null)
            .build();
    }

    /**
     * ACCEPTED -> POSTED, recording where the ad was placed.
     */
    public Campaign markPosted(String placementReference, Instant now) {
        requireStatus(CampaignStatus.ACCEPTED, "mark posted");
        if (placementReference == null || placementReference.isBlank()) {
            throw new IllegalArgumentException("Placement reference is required");
        }
        return moveTo(CampaignStatus.POSTED, now)
            .placementRef(placementReference)
            .postedAt(now)
            .build();
    }

    /**
     * POSTED -> CONFIRMED.
     */
    public Campaign confirm(Instant now) {
        requireStatus(CampaignStatus.POSTED, "confirm");
        return moveTo(CampaignStatus.CONFIRMED, now).build();
    }

    /**
     * POSTED -> REFUNDED when the placement is gone at confirmation time.
     */
    public Campaign failPlacement(String reason, Instant now) {
        requireStatus(CampaignStatus.POSTED, "fail placement");
        return moveTo(CampaignStatus.REFUNDED, now).failureReason(reason).build();
    }

    /**
     * Advertiser cancellation, allowed before acceptance only.
     */
    public Campaign cancel(Instant now) {
        if (!status.isAdvertiserCancellable()) {
            throw new InvalidTransitionException(
                String.format("Cannot cancel campaign %s in %s status", id, status));
        }
        return moveTo(CampaignStatus.CANCELLED, now).failureReason("Cancelled by advertiser").build();
    }

    /**
     * ACCEPTED -> CANCELLED, used when the bound channel is lost with no time left to find another.
     */
    public Campaign systemCancel(String reason, Instant now) {
        requireStatus(CampaignStatus.ACCEPTED, "cancel");
        return moveTo(CampaignStatus.CANCELLED, now).failureReason(reason).build();
    }

    /**
     * FUNDED, OFFERED or ACCEPTED -> EXPIRED, once the deadline has passed.
     */
    public Campaign expire(Instant now) {
        if (!status.isExpirable()) {
            throw new InvalidTransitionException(
                String.format("Cannot expire campaign %s in %s status", id, status));
        }
        if (!isPastDeadline(now)) {
            throw new InvalidTransitionException("Campaign " + id + " is not past its deadline " + expiresAt);
        }
        return moveTo(CampaignStatus.EXPIRED, now).failureReason("Expired").build();
    }

    /**
     * ACCEPTED -> OFFERED. Unbinds the channel and excludes its owner from this campaign.
     */
    public Campaign reoffer(String reason, Instant now) {
        requireStatus(CampaignStatus.ACCEPTED, "re-offer");
        Set<UUID> excluded = new HashSet<>(excludedOwnerIds);
        if (channelOwnerId != null) {
            excluded.add(channelOwnerId);
        }
        return moveTo(CampaignStatus.OFFERED, now)
            .channelId(null)
            .channelOwnerId(null)
            .placementRef(null)
            .failureReason(reason)
            .excludedOwnerIds(Set.copyOf(excluded))
            .build();
    }

    public Set<UUID> getExcludedOwnerIds() {
        return excludedOwnerIds == null ? Set.of() : Set.copyOf(excludedOwnerIds);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isPastDeadline(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isExcluded(UUID ownerId) {
        return excludedOwnerIds != null && excludedOwnerIds.contains(ownerId);
    }

    public boolean isOwnedBy(UUID userId) {
        return advertiserId.equals(userId);
    }

    /**
     * When the placement must still exist for the campaign to be confirmed.
     */
    public Instant confirmationDueAt() {
        if (postedAt == null) {
            throw new IllegalStateException("Campaign " + id + " has not been posted");
        }
        return postedAt.plus(targetDuration);
    }

    /**
     * Checks whether a transition from the current status to {@code target} exists.
     */
    public boolean canTransitionTo(CampaignStatus target) {
        if (this.status == target) {
            return true;
        }
        return switch (this.status) {
            case DRAFT -> target == CampaignStatus.PENDING_FUNDING || target == CampaignStatus.CANCELLED;
            case PENDING_FUNDING -> target == CampaignStatus.FUNDED || target == CampaignStatus.CANCELLED;
            case FUNDED -> target == CampaignStatus.OFFERED || target == CampaignStatus.CANCELLED
                || target == CampaignStatus.EXPIRED;
            case OFFERED -> target == CampaignStatus.ACCEPTED || target == CampaignStatus.CANCELLED
                || target == CampaignStatus.EXPIRED;
            case ACCEPTED -> target == CampaignStatus.POSTED || target == CampaignStatus.OFFERED
                || target == CampaignStatus.CANCELLED || target == CampaignStatus.EXPIRED;
            case POSTED -> target == CampaignStatus.CONFIRMED || target == CampaignStatus.REFUNDED;
            case CONFIRMED, CANCELLED, REFUNDED, EXPIRED -> false;
        };
    }

    private void requireStatus(CampaignStatus expected, String action) {
        if (this.status != expected) {
            throw new InvalidTransitionException(
                String.format("Cannot %s campaign %s in %s status. Only %s campaigns allow it.",
                    action, id, status, expected));
        }
    }

    private CampaignBuilder moveTo(CampaignStatus target, Instant now) {
        return toBuilder().status(target).updatedAt(now);
    }
}
