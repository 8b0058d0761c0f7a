package com.flagship.ad_escrow.command;

import com.flagship.ad_escrow.campaign.AdContentPolicy;
import com.flagship.ad_escrow.campaign.Campaign;
import com.flagship.ad_escrow.campaign.CampaignPersistenceService;
import com.flagship.ad_escrow.campaign.CampaignStateMachine;
import com.flagship.ad_escrow.channel.Channel;
import com.flagship.ad_escrow.channel.ChannelService;
import com.flagship.ad_escrow.channel.ChannelVerifier;
import com.flagship.ad_escrow.channel.VerificationResult;
import com.flagship.ad_escrow.error.EscrowEngineException;
import com.flagship.ad_escrow.error.NotFoundException;
import com.flagship.ad_escrow.error.VerificationFailedException;
import com.flagship.ad_escrow.escrow.EscrowCoordinator;
import com.flagship.ad_escrow.escrow.EscrowHold;
import com.flagship.ad_escrow.ledger.LedgerService;
import com.flagship.ad_escrow.ledger.LedgerTransaction;
import com.flagship.ad_escrow.ledger.TransactionKind;
import com.flagship.ad_escrow.observability.EngineMetrics;
import com.flagship.ad_escrow.session.ConversationStep;
import com.flagship.ad_escrow.session.SessionState;
import com.flagship.ad_escrow.session.SessionStateService;
import com.flagship.ad_escrow.user.User;
import com.flagship.ad_escrow.user.UserRole;
import com.flagship.ad_escrow.user.UserService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for every user-initiated operation.
 *
 * Each command validates the acting user, delegates to the owning component and
 * either returns a result or throws an {@link EscrowEngineException}. Lock
 * acquisition failures and deadlocks are retried here, outside the transaction
 * that lost.
 */
@Service
@Slf4j
@Retryable(
    retryFor = PessimisticLockingFailureException.class,
    maxAttemptsExpression = "${command.retry.max-attempts:3}",
    backoff = @Backoff(delayExpression = "${command.retry.delay-ms:50}", multiplier = 2.0)
)
public class CampaignCommandService {

    private final UserService userService;
    private final LedgerService ledgerService;
    private final ChannelService channelService;
    private final ChannelVerifier channelVerifier;
    private final CampaignStateMachine stateMachine;
    private final CampaignPersistenceService campaigns;
    private final EscrowCoordinator escrow;
    private final AdContentPolicy contentPolicy;
    private final IdempotencyService idempotencyService;
    private final SessionStateService sessions;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final Duration defaultTargetDuration;
    private final Duration offerLifetime;
    private final long maxBudget;

    public CampaignCommandService(UserService userService,
                                  LedgerService ledgerService,
                                  ChannelService channelService,
                                  ChannelVerifier channelVerifier,
                                  CampaignStateMachine stateMachine,
                                  CampaignPersistenceService campaigns,
                                  EscrowCoordinator escrow,
                                  AdContentPolicy contentPolicy,
                                  IdempotencyService idempotencyService,
                                  SessionStateService sessions,
                                  EngineMetrics metrics,
                                  Clock clock,
                                  @Value("${campaign.default-target-duration:PT1H}") Duration defaultTargetDuration,
                                  @Value("${campaign.offer-lifetime:P7D}") Duration offerLifetime,
                                  @Value("${campaign.max-budget:1000000}") long maxBudget) {
        this.userService = userService;
        this.ledgerService = ledgerService;
        this.channelService = channelService;
        this.channelVerifier = channelVerifier;
        this.stateMachine = stateMachine;
        this.campaigns = campaigns;
        this.escrow = escrow;
        this.contentPolicy = contentPolicy;
        this.idempotencyService = idempotencyService;
        this.sessions = sessions;
        this.metrics = metrics;
        this.clock = clock;
        this.defaultTargetDuration = defaultTargetDuration;
        this.offerLifetime = offerLifetime;
        this.maxBudget = maxBudget;
    }

    // Users and balances

    public User registerUser(long externalId, String username, UserRole role) {
        return timed("register_user", () -> userService.register(externalId, username, role));
    }

    public User deactivateUser(UUID userId) {
        return timed("deactivate_user", () -> userService.deactivate(userId));
    }

    /**
     * Credits the user's balance. Repeating the same key returns the original transaction.
     */
    public LedgerTransaction topUp(UUID userId, long amount, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        return timed("top_up", () -> {
            userService.requireActive(userId);
            return ledgerService.credit(userId, amount, "topup:" + userId + ":" + idempotencyKey,
                    TransactionKind.TOPUP);
        });
    }

    public long getBalance(UUID userId) {
        userService.requireActive(userId);
        return ledgerService.balance(userId);
    }

    public List<LedgerTransaction> listTransactions(UUID userId) {
        userService.requireActive(userId);
        return ledgerService.transactions(userId);
    }

    // Channels

    public Channel registerChannel(UUID ownerId, String externalChannelId, String title) {
        return timed("register_channel", () -> channelService.register(ownerId, externalChannelId, title));
    }

    public VerificationResult verifyChannel(UUID ownerId, UUID channelId) {
        return timed("verify_channel", () -> {
            Channel channel = channelService.require(channelId);
            if (!channel.isOwnedBy(ownerId)) {
                throw new NotFoundException("Channel not found: " + channelId);
            }
            return channelVerifier.verify(channelId);
        });
    }

    public List<Channel> listChannels(UUID ownerId) {
        userService.requireActive(ownerId);
        return channelService.listByOwner(ownerId);
    }

    // Campaigns

    /**
     * Creates a campaign in PENDING_FUNDING. A repeated key returns the campaign created first.
     *
     * @param targetDuration how long the ad must stay up, or null for the default
     */
    public CampaignCreation createCampaign(UUID advertiserId, String adContent, long budget,
                                           Duration targetDuration, String idempotencyKey) {
        return timed("create_campaign", () -> {
            Optional<UUID> existing = idempotencyService.findCampaignId(advertiserId, idempotencyKey);
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotency key already used, returning campaign {}", existing.get());
                return new CampaignCreation(campaigns.require(existing.get()), true);
            }
            metrics.recordIdempotencyMiss();

            requireAdvertiser(advertiserId);
            contentPolicy.check(adContent);
            if (budget > maxBudget) {
                throw new IllegalArgumentException("Budget exceeds the maximum of " + maxBudget);
            }
            Duration duration = targetDuration != null ? targetDuration : defaultTargetDuration;
            Instant expiresAt = clock.instant().plus(offerLifetime);

            Campaign created;
            try {
                created = stateMachine.create(advertiserId, adContent, budget, duration, expiresAt,
                        IdempotencyService.scopedKey(advertiserId, idempotencyKey));
            } catch (DataIntegrityViolationException e) {
                // a concurrent request with the same key won the insert
                return idempotencyService.findCampaignId(advertiserId, idempotencyKey)
                    .map(campaignId -> new CampaignCreation(campaigns.require(campaignId), true))
                    .orElseThrow(() -> e);
            }
            idempotencyService.remember(advertiserId, idempotencyKey, created.getId());
            log.info("Campaign created: campaignId={}, advertiserId={}, budget={}", created.getId(), advertiserId, budget);
            return new CampaignCreation(created, false);
        });
    }

    /**
     * Holds the budget in escrow and puts the campaign on offer.
     * If the offer step fails the campaign stays FUNDED and the stalled sweep offers it later.
     */
    public Campaign fundCampaign(UUID advertiserId, UUID campaignId) {
        return timed("fund_campaign", () -> {
            requireAdvertiser(advertiserId);
            Campaign funded = stateMachine.fund(campaignId, advertiserId);
            try {
                return stateMachine.offer(campaignId);
            } catch (RuntimeException e) {
                log.warn("Funded campaign {} could not be offered yet: {}", campaignId, e.getMessage());
                return funded;
            }
        });
    }

    public Campaign cancelCampaign(UUID advertiserId, UUID campaignId) {
        return timed("cancel_campaign", () -> {
            userService.requireActive(advertiserId);
            return stateMachine.cancel(campaignId, advertiserId);
        });
    }

    /**
     * Open offers the owner may accept; empty while the owner has no verified channel.
     */
    public List<Campaign> listOffers(UUID ownerId) {
        return timed("list_offers", () -> {
            userService.requireActive(ownerId);
            if (!channelService.hasVerifiedChannel(ownerId)) {
                return List.of();
            }
            return campaigns.findOpenOffersFor(ownerId, clock.instant());
        });
    }

    public Campaign acceptOffer(UUID ownerId, UUID campaignId, UUID channelId) {
        return timed("accept_offer", () -> {
            User owner = userService.requireActive(ownerId);
            if (!owner.canOwnChannels()) {
                throw new VerificationFailedException("User " + ownerId + " cannot own channels");
            }
            return stateMachine.accept(campaignId, ownerId, channelId);
        });
    }

    /**
     * A campaign as seen by its advertiser or the owner of the channel it is bound to.
     * Anyone else gets NOT_FOUND.
     */
    public Campaign getCampaign(UUID userId, UUID campaignId) {
        userService.requireActive(userId);
        Campaign campaign = campaigns.require(campaignId);
        if (!campaign.isOwnedBy(userId) && !userId.equals(campaign.getChannelOwnerId())) {
            throw new NotFoundException("Campaign not found: " + campaignId);
        }
        return campaign;
    }

    public Optional<EscrowHold> getHold(UUID campaignId) {
        return escrow.findByCampaignId(campaignId);
    }

    public List<Campaign> listCampaigns(UUID advertiserId) {
        userService.requireActive(advertiserId);
        return campaigns.listByAdvertiser(advertiserId);
    }

    // Dialogue sessions

    public SessionState getSession(UUID userId) {
        userService.requireActive(userId);
        return sessions.current(userId);
    }

    public SessionState advanceSession(UUID userId, ConversationStep step, Map<String, String> attributes) {
        userService.requireActive(userId);
        return sessions.advance(userId, step, attributes != null ? attributes : Map.of());
    }

    public void clearSession(UUID userId) {
        userService.requireActive(userId);
        sessions.clear(userId);
    }

    /**
     * A created campaign, or the one an earlier request with the same key created.
     */
    @lombok.Value
    public static class CampaignCreation {
        Campaign campaign;
        boolean replayed;
    }

    private void requireAdvertiser(UUID userId) {
        User user = userService.requireActive(userId);
        if (!user.canAdvertise()) {
            throw new VerificationFailedException("User " + userId + " cannot advertise");
        }
    }

    private <T> T timed(String command, Supplier<T> action) {
        long start = System.currentTimeMillis();
        try {
            return action.get();
        } finally {
            metrics.recordCommandLatency(command, System.currentTimeMillis() - start);
        }
    }
}
