package com.flagship.ad_escrow.scenario;

import com.flagship.ad_escrow.campaign.Campaign;
import com.flagship.ad_escrow.campaign.CampaignPersistenceService;
import com.flagship.ad_escrow.campaign.CampaignStatus;
import com.flagship.ad_escrow.campaign.ChannelRevocationHandler;
import com.flagship.ad_escrow.channel.Channel;
import com.flagship.ad_escrow.channel.ChannelProbeResult;
import com.flagship.ad_escrow.channel.ChannelStatus;
import com.flagship.ad_escrow.error.InsufficientFundsException;
import com.flagship.ad_escrow.escrow.EscrowCoordinator;
import com.flagship.ad_escrow.escrow.EscrowHold;
import com.flagship.ad_escrow.escrow.EscrowHoldStatus;
import com.flagship.ad_escrow.maintenance.CampaignMaintenanceService;
import com.flagship.ad_escrow.posting.PostingOrchestrator;
import com.flagship.ad_escrow.posting.PostingResult;
import com.flagship.ad_escrow.support.IntegrationTestBase;
import com.flagship.ad_escrow.user.UserRole;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end campaign lifecycles against a real database and the simulated chat platform.
 *
 * Every scenario ends with both parties' ledgers reconciled: no value is created or lost.
 */
class CampaignLifecycleScenarioTest extends IntegrationTestBase {

    @Autowired
    private CampaignPersistenceService campaigns;

    @Autowired
    private EscrowCoordinator escrow;

    @Autowired
    private PostingOrchestrator postingOrchestrator;

    @Autowired
    private ChannelRevocationHandler revocationHandler;

    @Autowired
    private CampaignMaintenanceService maintenance;

    private UUID advertiserId;
    private UUID ownerId;
    private Channel channel;

    @BeforeEach
    void setUp() {
        advertiserId = newUser(UserRole.ADVERTISER).getId();
        ownerId = newUser(UserRole.CHANNEL_OWNER).getId();
        channel = verifiedChannel(ownerId);
        topUp(advertiserId, 1000);
    }

    private Campaign acceptedCampaign(long budget) {
        Campaign offered = offeredCampaign(advertiserId, budget);
        return commands.acceptOffer(ownerId, offered.getId(), channel.getId());
    }

    private Campaign reload(Campaign campaign) {
        return campaigns.require(campaign.getId());
    }

    private EscrowHold holdOf(Campaign campaign) {
        return escrow.findByCampaignId(campaign.getId()).orElseThrow();
    }

    private void assertReconciled() {
        assertTrue(ledgerService.reconcile(advertiserId));
        assertTrue(ledgerService.reconcile(ownerId));
    }

    @Test
    @DisplayName("Happy path: fund 500, accept, post, confirm pays the owner")
    void happyPath() {
        Campaign offered = offeredCampaign(advertiserId, 500);
        assertEquals(CampaignStatus.OFFERED, offered.getStatus());
        assertEquals(500, ledgerService.balance(advertiserId));
        assertTrue(commands.listOffers(ownerId).stream().anyMatch(c -> c.getId().equals(offered.getId())));

        Campaign accepted = commands.acceptOffer(ownerId, offered.getId(), channel.getId());
        assertEquals(CampaignStatus.ACCEPTED, accepted.getStatus());

        PostingResult posting = postingOrchestrator.post(offered.getId());
        assertTrue(posting.isPosted());
        Campaign posted = reload(offered);
        assertEquals(CampaignStatus.POSTED, posted.getStatus());
        assertEquals(posting.getPlacementRef(), posted.getPlacementRef());

        clock.advance(Duration.ofHours(1));
        assertTrue(postingOrchestrator.confirmCompletion(offered.getId()));

        assertEquals(CampaignStatus.CONFIRMED, reload(offered).getStatus());
        assertEquals(EscrowHoldStatus.RELEASED, holdOf(offered).getStatus());
        assertEquals(500, ledgerService.balance(advertiserId));
        assertEquals(500, ledgerService.balance(ownerId));
        assertReconciled();
    }

    @Test
    @DisplayName("Placement removed before the target duration refunds the advertiser")
    void placementRemoved() {
        Campaign accepted = acceptedCampaign(400);
        PostingResult posting = postingOrchestrator.post(accepted.getId());
        gateway.removePlacement(posting.getPlacementRef());

        clock.advance(Duration.ofHours(1));
        assertFalse(postingOrchestrator.confirmCompletion(accepted.getId()));

        assertEquals(CampaignStatus.REFUNDED, reload(accepted).getStatus());
        assertEquals(1000, ledgerService.balance(advertiserId));
        assertEquals(0, ledgerService.balance(ownerId));
        assertReconciled();
    }

    @Test
    @DisplayName("Offer past its deadline expires and refunds")
    void expireWhileOffered() {
        Campaign offered = offeredCampaign(advertiserId, 300);

        clock.advance(Duration.ofDays(7));
        maintenance.expireDueCampaigns();

        assertEquals(CampaignStatus.EXPIRED, reload(offered).getStatus());
        assertEquals(EscrowHoldStatus.REFUNDED, holdOf(offered).getStatus());
        assertEquals(1000, ledgerService.balance(advertiserId));
        assertTrue(commands.listOffers(ownerId).stream().noneMatch(c -> c.getId().equals(offered.getId())));
        assertReconciled();
    }

    @Test
    @DisplayName("Advertiser cancels a funded offer and gets the budget back")
    void fundThenCancel() {
        Campaign offered = offeredCampaign(advertiserId, 600);
        assertEquals(400, ledgerService.balance(advertiserId));

        Campaign cancelled = commands.cancelCampaign(advertiserId, offered.getId());

        assertEquals(CampaignStatus.CANCELLED, cancelled.getStatus());
        assertEquals(EscrowHoldStatus.REFUNDED, holdOf(offered).getStatus());
        assertEquals(1000, ledgerService.balance(advertiserId));
        assertReconciled();
    }

    @Test
    @DisplayName("Budget equal to the balance is funded; one more is rejected")
    void budgetBoundary() {
        Campaign exact = offeredCampaign(advertiserId, 1000);
        assertEquals(CampaignStatus.OFFERED, exact.getStatus());
        assertEquals(0, ledgerService.balance(advertiserId));

        topUp(advertiserId, 100);
        Campaign tooBig = commands.createCampaign(advertiserId, "One more bakery ad", 101, null,
                UUID.randomUUID().toString()).getCampaign();

        assertThrows(InsufficientFundsException.class, () -> commands.fundCampaign(advertiserId, tooBig.getId()));
        assertEquals(CampaignStatus.PENDING_FUNDING, reload(tooBig).getStatus());
        assertEquals(100, ledgerService.balance(advertiserId));
        assertReconciled();
    }

    @Nested
    @DisplayName("Channel revoked while a campaign is accepted")
    class Revocation {

        private void revokeChannel() {
            gateway.setProbeResult(channel.getExternalId(), ChannelProbeResult.notAdmin());
            assertEquals(ChannelStatus.REVOKED, channelVerifier.verify(channel.getId()).getStatus());
        }

        @Test
        @DisplayName("With time left the campaign is offered again without the revoked owner")
        void reofferedWithTimeLeft() {
            Campaign accepted = acceptedCampaign(500);

            revokeChannel();
            revocationHandler.handleRevocation(channel.getId());

            Campaign reoffered = reload(accepted);
            assertEquals(CampaignStatus.OFFERED, reoffered.getStatus());
            assertNull(reoffered.getChannelId());
            assertTrue(reoffered.isExcluded(ownerId));
            assertEquals(EscrowHoldStatus.HELD, holdOf(accepted).getStatus());
            assertEquals(500, ledgerService.balance(advertiserId));
            assertReconciled();
        }

        @Test
        @DisplayName("Close to the deadline the campaign is cancelled and refunded")
        void cancelledNearDeadline() {
            Campaign accepted = acceptedCampaign(500);
            clock.set(accepted.getExpiresAt().minus(Duration.ofMinutes(30)));

            revokeChannel();
            revocationHandler.handleRevocation(channel.getId());

            assertEquals(CampaignStatus.CANCELLED, reload(accepted).getStatus());
            assertEquals(EscrowHoldStatus.REFUNDED, holdOf(accepted).getStatus());
            assertEquals(1000, ledgerService.balance(advertiserId));
            assertReconciled();
        }

        @Test
        @DisplayName("A channel that dropped to PENDING is not posted to and the campaign goes back on offer")
        void pendingChannelNotPosted() {
            Campaign accepted = acceptedCampaign(500);
            gateway.setProbeResult(channel.getExternalId(), ChannelProbeResult.admin(10));
            assertEquals(ChannelStatus.PENDING, channelVerifier.verify(channel.getId()).getStatus());

            assertEquals(PostingResult.Outcome.SKIPPED, postingOrchestrator.post(accepted.getId()).getOutcome());
            assertEquals(PostingResult.Outcome.SKIPPED, postingOrchestrator.post(accepted.getId()).getOutcome());

            Campaign reoffered = reload(accepted);
            assertEquals(CampaignStatus.OFFERED, reoffered.getStatus());
            assertNull(reoffered.getPlacementRef());
            assertTrue(reoffered.isExcluded(ownerId));
            assertEquals(EscrowHoldStatus.HELD, holdOf(accepted).getStatus());
            assertReconciled();
        }
    }

    @Test
    @DisplayName("Posting retries exhaust, the campaign is re-offered and the channel penalized")
    void postingRetryExhaustion() {
        Campaign accepted = acceptedCampaign(250);
        gateway.failNextPublishes(channel.getExternalId(), 10, true);

        PostingResult first = postingOrchestrator.post(accepted.getId());
        assertEquals(PostingResult.Outcome.RETRY_SCHEDULED, first.getOutcome());

        Awaitility.await()
                .atMost(Duration.ofSeconds(10))
                .untilAsserted(() -> assertEquals(CampaignStatus.OFFERED, reload(accepted).getStatus()));

        Campaign reoffered = reload(accepted);
        assertTrue(reoffered.isExcluded(ownerId));
        Awaitility.await()
                .atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertEquals(Channel.MAX_TRUST_SCORE - 10,
                        channelService.require(channel.getId()).getTrustScore()));
        assertEquals(EscrowHoldStatus.HELD, holdOf(accepted).getStatus());
        assertEquals(750, ledgerService.balance(advertiserId));
        assertReconciled();
    }

    @Test
    @DisplayName("A transient publish failure is retried and then succeeds")
    void postingRecoversAfterRetry() {
        Campaign accepted = acceptedCampaign(250);
        gateway.failNextPublishes(channel.getExternalId(), 2, true);

        postingOrchestrator.post(accepted.getId());

        Awaitility.await()
                .atMost(Duration.ofSeconds(10))
                .untilAsserted(() -> assertEquals(CampaignStatus.POSTED, reload(accepted).getStatus()));
        assertEquals(Channel.MAX_TRUST_SCORE, channelService.require(channel.getId()).getTrustScore());
    }
}
