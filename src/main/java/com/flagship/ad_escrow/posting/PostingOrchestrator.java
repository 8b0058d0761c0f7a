package com.flagship.ad_escrow.posting;

import com.flagship.ad_escrow.campaign.Campaign;
import com.flagship.ad_escrow.campaign.CampaignPersistenceService;
import com.flagship.ad_escrow.campaign.CampaignStateMachine;
import com.flagship.ad_escrow.campaign.CampaignStatus;
import com.flagship.ad_escrow.campaign.CampaignTransitionedEvent;
import com.flagship.ad_escrow.campaign.ChannelRevocationHandler;
import com.flagship.ad_escrow.channel.Channel;
import com.flagship.ad_escrow.channel.ChannelService;
import com.flagship.ad_escrow.channel.ChannelVerifier;
import com.flagship.ad_escrow.error.EscrowEngineException;
import com.flagship.ad_escrow.error.PlacementFailedException;
import com.flagship.ad_escrow.error.VerificationFailedException;
import com.flagship.ad_escrow.gateway.OutboundCallExecutor;
import com.flagship.ad_escrow.observability.CorrelationContext;
import com.flagship.ad_escrow.observability.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Places accepted campaigns and confirms them at the end of their target duration.
 *
 * Gateway calls happen outside any database transaction and under a timeout. Retries
 * are separate tasks in the {@link CampaignTaskRegistry}, keyed by campaign id, so a
 * transition out of ACCEPTED or POSTED can cancel whatever is pending.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostingOrchestrator {

    static final String POSTING_FAILED_REASON = "Ad could not be posted to the channel";
    static final String PLACEMENT_MISSING_REASON = "Ad was removed before the target duration elapsed";
    static final String CHANNEL_UNVERIFIED_REASON = "Channel is no longer verified";

    private final CampaignStateMachine stateMachine;
    private final CampaignPersistenceService campaigns;
    private final ChannelService channelService;
    private final ChannelVerifier channelVerifier;
    private final ChannelRevocationHandler revocationHandler;
    private final PostingTransport transport;
    private final OutboundCallExecutor outbound;
    private final CampaignTaskRegistry tasks;
    private final PostingPolicy policy;
    private final EngineMetrics metrics;
    private final Clock clock;

    /**
     * First posting attempt for an accepted campaign.
     */
    public PostingResult post(UUID campaignId) {
        return attemptPost(campaignId, 1);
    }

    PostingResult attemptPost(UUID campaignId, int attempt) {
        try (CorrelationContext.Scope ignored = CorrelationContext.openCampaignScope(campaignId)) {
            Campaign campaign = campaigns.require(campaignId);
            if (campaign.getStatus() != CampaignStatus.ACCEPTED) {
                log.info("Posting skipped, campaign is {}", campaign.getStatus());
                metrics.recordPostingAttempt("skipped");
                return PostingResult.skipped(campaignId, attempt);
            }
            Channel channel = channelService.require(campaign.getChannelId());
            if (!channel.isVerified()) {
                return onChannelUnverified(campaign, channel, attempt);
            }

            String placementRef;
            try {
                placementRef = outbound.call("publish",
                        () -> transport.publish(channel.getExternalId(), campaign.getAdContent()),
                        policy.getPublishTimeout());
            } catch (TimeoutException e) {
                return onPostingFailure(campaign, attempt, true, "Publish timed out after " + policy.getPublishTimeout(), e);
            } catch (PostingTransportException e) {
                return onPostingFailure(campaign, attempt, e.isTransient(), e.getMessage(), e);
            }

            try {
                stateMachine.markPosted(campaignId, placementRef);
            } catch (VerificationFailedException e) {
                // verification dropped while the publish was in flight
                log.warn("Placement {} left without a campaign: {}", placementRef, e.getMessage());
                metrics.recordPostingAttempt("channel_unverified");
                revocationHandler.unbind(campaignId, CHANNEL_UNVERIFIED_REASON);
                return PostingResult.skipped(campaignId, attempt);
            } catch (EscrowEngineException e) {
                // the ad is live but the campaign moved on while we were publishing
                log.warn("Placement {} left without a campaign: {}", placementRef, e.getMessage());
                metrics.recordPostingAttempt("orphaned");
                return PostingResult.skipped(campaignId, attempt);
            }
            metrics.recordPostingAttempt("success");
            log.info("Ad posted: channelId={}, placementRef={}, attempt={}", channel.getId(), placementRef, attempt);
            return PostingResult.posted(campaignId, attempt, placementRef);
        }
    }

    private PostingResult onChannelUnverified(Campaign campaign, Channel channel, int attempt) {
        log.warn("Posting skipped, channel {} is {}", channel.getId(), channel.getStatus());
        metrics.recordPostingAttempt("channel_unverified");
        revocationHandler.unbind(campaign.getId(), CHANNEL_UNVERIFIED_REASON);
        return PostingResult.skipped(campaign.getId(), attempt);
    }

    private PostingResult onPostingFailure(Campaign campaign, int attempt, boolean transientFailure,
                                           String message, Exception cause) {
        UUID campaignId = campaign.getId();
        if (transientFailure && policy.hasAttemptsLeft(attempt)) {
            Instant nextAttemptAt = clock.instant().plus(policy.backoffFor(attempt));
            tasks.schedule(campaignId, () -> attemptPost(campaignId, attempt + 1), nextAttemptAt);
            metrics.recordPostingAttempt("retry");
            log.warn("Posting attempt {}/{} failed, retrying at {}: {}",
                    attempt, policy.getMaxAttempts(), nextAttemptAt, message);
            return PostingResult.retryScheduled(campaignId, attempt);
        }

        PlacementFailedException failure = new PlacementFailedException(campaignId, attempt, message, cause);
        metrics.recordPostingAttempt(transientFailure ? "exhausted" : "permanent_failure");
        log.warn("Posting failed after {} attempt(s), re-offering: {}", attempt, message);

        try {
            stateMachine.reoffer(campaignId, POSTING_FAILED_REASON);
        } catch (EscrowEngineException e) {
            log.info("Re-offer skipped: {}", e.getMessage());
        }
        channelVerifier.penalize(campaign.getChannelId(), policy.getTrustPenalty());
        return PostingResult.failed(campaignId, attempt, failure);
    }

    /**
     * Checks that the placement survived the target duration and settles the campaign.
     *
     * @return true when the campaign was confirmed by this call
     */
    public boolean confirmCompletion(UUID campaignId) {
        return attemptConfirm(campaignId, 1);
    }

    boolean attemptConfirm(UUID campaignId, int attempt) {
        try (CorrelationContext.Scope ignored = CorrelationContext.openCampaignScope(campaignId)) {
            Campaign campaign = campaigns.require(campaignId);
            if (campaign.getStatus() != CampaignStatus.POSTED) {
                log.info("Confirmation skipped, campaign is {}", campaign.getStatus());
                return false;
            }

            boolean present;
            try {
                present = outbound.call("exists",
                        () -> transport.exists(campaign.getPlacementRef()),
                        policy.getPublishTimeout());
            } catch (TimeoutException | PostingTransportException e) {
                boolean transientFailure = !(e instanceof PostingTransportException)
                        || ((PostingTransportException) e).isTransient();
                if (transientFailure && policy.hasAttemptsLeft(attempt)) {
                    Instant nextAttemptAt = clock.instant().plus(policy.backoffFor(attempt));
                    tasks.schedule(campaignId, () -> attemptConfirm(campaignId, attempt + 1), nextAttemptAt);
                    metrics.recordConfirmation("retry");
                    log.warn("Placement check {}/{} failed, retrying at {}: {}",
                            attempt, policy.getMaxAttempts(), nextAttemptAt, e.getMessage());
                    return false;
                }
                log.warn("Placement could not be checked after {} attempt(s), treating as removed: {}",
                        attempt, e.getMessage());
                present = false;
            }

            try {
                if (present) {
                    stateMachine.confirm(campaignId);
                    metrics.recordConfirmation("confirmed");
                    return true;
                }
                stateMachine.failPlacement(campaignId, PLACEMENT_MISSING_REASON);
                metrics.recordConfirmation("refunded");
                return false;
            } catch (EscrowEngineException e) {
                log.info("Confirmation skipped: {}", e.getMessage());
                return false;
            }
        }
    }

    /**
     * Schedules posting on acceptance and confirmation on posting; drops pending tasks otherwise.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onCampaignTransitioned(CampaignTransitionedEvent event) {
        Campaign after = event.getAfter();
        switch (after.getStatus()) {
            case ACCEPTED -> {
                if (policy.isAutoStart()) {
                    schedulePosting(after.getId(), clock.instant());
                }
            }
            case POSTED -> scheduleConfirmation(after.getId(), after.confirmationDueAt());
            default -> {
                if (event.getFromStatus() == CampaignStatus.ACCEPTED || event.getFromStatus() == CampaignStatus.POSTED) {
                    tasks.cancel(after.getId());
                }
            }
        }
    }

    public void schedulePosting(UUID campaignId, Instant runAt) {
        tasks.schedule(campaignId, () -> post(campaignId), runAt);
    }

    public void scheduleConfirmation(UUID campaignId, Instant dueAt) {
        tasks.schedule(campaignId, () -> confirmCompletion(campaignId), dueAt);
    }

    /**
     * Re-drives ACCEPTED and POSTED campaigns that have no pending task, e.g. after a restart.
     *
     * @return number of campaigns rescheduled
     */
    public int recoverStalled() {
        Instant now = clock.instant();
        int rescheduled = 0;
        for (UUID campaignId : campaigns.findIdsByStatus(CampaignStatus.ACCEPTED)) {
            if (!tasks.hasTask(campaignId)) {
                schedulePosting(campaignId, now);
                rescheduled++;
            }
        }
        for (UUID campaignId : campaigns.findIdsByStatus(CampaignStatus.POSTED)) {
            if (tasks.hasTask(campaignId)) {
                continue;
            }
            try (CorrelationContext.Scope ignored = CorrelationContext.openCampaignScope(campaignId)) {
                Instant dueAt = campaigns.require(campaignId).confirmationDueAt();
                scheduleConfirmation(campaignId, dueAt.isAfter(now) ? dueAt : now);
                rescheduled++;
            } catch (RuntimeException e) {
                log.error("Failed to reschedule confirmation for campaign {}", campaignId, e);
            }
        }
        if (rescheduled > 0) {
            log.info("Recovered {} campaign(s) without a pending posting task", rescheduled);
        }
        return rescheduled;
    }

    public int pendingTasks() {
        return tasks.activeCount();
    }
}
