package com.flagship.ad_escrow.campaign;

import com.flagship.ad_escrow.campaign.event.CampaignLifecycleEvent;
import com.flagship.ad_escrow.channel.Channel;
import com.flagship.ad_escrow.channel.ChannelService;
import com.flagship.ad_escrow.error.InsufficientFundsException;
import com.flagship.ad_escrow.error.NotFoundException;
import com.flagship.ad_escrow.error.VerificationFailedException;
import com.flagship.ad_escrow.escrow.EscrowCoordinator;
import com.flagship.ad_escrow.observability.CorrelationContext;
import com.flagship.ad_escrow.observability.EngineMetrics;
import com.flagship.ad_escrow.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Drives campaigns through their lifecycle.
 *
 * Every transition runs in one database transaction:
 * 1. lock the campaign row
 * 2. apply the domain transition (validates the current status)
 * 3. move funds through the {@link EscrowCoordinator} where the transition requires it
 * 4. persist, write the lifecycle event to the outbox, publish {@link CampaignTransitionedEvent}
 *
 * Two callers racing on one campaign serialize on the row lock; the loser sees the
 * winner's committed status and fails the domain check.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignStateMachine {

    private final CampaignPersistenceService persistence;
    private final EscrowCoordinator escrow;
    private final ChannelService channelService;
    private final OutboxService outboxService;
    private final ApplicationEventPublisher eventPublisher;
    private final EngineMetrics metrics;
    private final Clock clock;

    /**
     * Creates a draft and submits it, leaving the campaign PENDING_FUNDING.
     */
    @Transactional
    public Campaign create(UUID advertiserId, String adContent, long budget, Duration targetDuration,
                           Instant expiresAt, String idempotencyKey) {
        Instant now = clock.instant();
        Campaign draft = Campaign.draft(UUID.randomUUID(), advertiserId, adContent, budget,
                targetDuration, now, expiresAt);
        Campaign submitted = draft.submit(now);

        persistence.insert(submitted, idempotencyKey);
        recordTransition(draft, submitted, now);
        return submitted;
    }

    /**
     * PENDING_FUNDING -> FUNDED. The escrow hold shares this transaction.
     *
     * @throws InsufficientFundsException if the advertiser cannot cover the budget; the campaign is unchanged
     */
    @Transactional
    public Campaign fund(UUID campaignId, UUID advertiserId) {
        return transition(campaignId, "fund", campaign -> {
            requireOwner(campaign, advertiserId);
            Campaign funded = campaign.fund(clock.instant());
            escrow.hold(funded);
            return funded;
        });
    }

    @Transactional
    public Campaign offer(UUID campaignId) {
        return transition(campaignId, "offer", campaign -> campaign.offer(clock.instant()));
    }

    /**
     * OFFERED -> ACCEPTED. The first claim wins; the claimant's channel must be VERIFIED.
     */
    @Transactional
    public Campaign accept(UUID campaignId, UUID ownerId, UUID channelId) {
        return transition(campaignId, "accept", campaign -> {
            Campaign accepted = campaign.accept(ownerId, channelId, clock.instant());
            channelService.lockVerifiedOwnedBy(channelId, ownerId);
            return accepted;
        });
    }

    /**
     * ACCEPTED -> POSTED once the placement is live. The bound channel must still be VERIFIED.
     */
    @Transactional
    public Campaign markPosted(UUID campaignId, String placementRef) {
        return transition(campaignId, "mark posted", campaign -> {
            Campaign posted = campaign.markPosted(placementRef, clock.instant());
            Channel channel = channelService.require(posted.getChannelId());
            if (!channel.isVerified()) {
                throw new VerificationFailedException(
                    "Channel " + channel.getId() + " is " + channel.getStatus() + ", not VERIFIED");
            }
            return posted;
        });
    }

    /**
     * POSTED -> CONFIRMED, releasing the hold to the channel owner.
     */
    @Transactional
    public Campaign confirm(UUID campaignId) {
        return transition(campaignId, "confirm", campaign -> {
            Campaign confirmed = campaign.confirm(clock.instant());
            var hold = escrow.findByCampaignId(campaignId)
                .orElseThrow(() -> new IllegalStateException("Posted campaign " + campaignId + " has no escrow hold"));
            escrow.release(hold.getId(), confirmed.getChannelOwnerId());
            return confirmed;
        });
    }

    /**
     * POSTED -> REFUNDED when the placement disappeared before the target duration elapsed.
     */
    @Transactional
    public Campaign failPlacement(UUID campaignId, String reason) {
        return transition(campaignId, "fail placement", campaign -> {
            Campaign refunded = campaign.failPlacement(reason, clock.instant());
            refundHold(campaignId);
            return refunded;
        });
    }

    /**
     * Advertiser cancellation before acceptance; refunds when funds are held.
     */
    @Transactional
    public Campaign cancel(UUID campaignId, UUID advertiserId) {
        return transition(campaignId, "cancel", campaign -> {
            requireOwner(campaign, advertiserId);
            Campaign cancelled = campaign.cancel(clock.instant());
            refundHold(campaignId);
            return cancelled;
        });
    }

    @Transactional
    public Campaign expire(UUID campaignId) {
        return transition(campaignId, "expire", campaign -> {
            Campaign expired = campaign.expire(clock.instant());
            refundHold(campaignId);
            return expired;
        });
    }

    /**
     * ACCEPTED -> OFFERED, excluding the previous channel owner. No funds move.
     */
    @Transactional
    public Campaign reoffer(UUID campaignId, String reason) {
        return transition(campaignId, "re-offer", campaign -> campaign.reoffer(reason, clock.instant()));
    }

    /**
     * Moves an ACCEPTED campaign off its channel: back to OFFERED when another owner still has
     * more than {@code recoveryWindow} to claim it, otherwise CANCELLED with a refund.
     * The deadline is read under the row lock.
     */
    @Transactional
    public Campaign unbindChannel(UUID campaignId, String reason, Duration recoveryWindow) {
        return transition(campaignId, "unbind channel", campaign -> {
            Instant now = clock.instant();
            if (campaign.getExpiresAt().isAfter(now.plus(recoveryWindow))) {
                return campaign.reoffer(reason, now);
            }
            Campaign cancelled = campaign.systemCancel(reason, now);
            refundHold(campaignId);
            return cancelled;
        });
    }

    private Campaign transition(UUID campaignId, String action, UnaryOperator<Campaign> change) {
        try (CorrelationContext.Scope ignored = CorrelationContext.openCampaignScope(campaignId)) {
            Campaign before = persistence.lock(campaignId);
            Campaign after = change.apply(before);

            persistence.update(before, after);
            recordTransition(before, after, after.getUpdatedAt());

            log.info("Campaign {}: {} -> {}", action, before.getStatus(), after.getStatus());
            return after;
        }
    }

    private void recordTransition(Campaign before, Campaign after, Instant occurredAt) {
        outboxService.append(CampaignLifecycleEvent.of(before, after, occurredAt));
        eventPublisher.publishEvent(new CampaignTransitionedEvent(before, after));
        metrics.recordTransition(before.getStatus().name(), after.getStatus().name());
    }

    private void refundHold(UUID campaignId) {
        escrow.findByCampaignId(campaignId).ifPresent(hold -> escrow.refund(hold.getId()));
    }

    // another advertiser's campaign is reported as missing
    private void requireOwner(Campaign campaign, UUID advertiserId) {
        if (!campaign.isOwnedBy(advertiserId)) {
            throw new NotFoundException("Campaign not found: " + campaign.getId());
        }
    }
}
