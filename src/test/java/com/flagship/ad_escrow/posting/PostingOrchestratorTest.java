package com.flagship.ad_escrow.posting;

import com.flagship.ad_escrow.campaign.Campaign;
import com.flagship.ad_escrow.campaign.CampaignPersistenceService;
import com.flagship.ad_escrow.campaign.CampaignStateMachine;
import com.flagship.ad_escrow.campaign.CampaignStatus;
import com.flagship.ad_escrow.campaign.CampaignTransitionedEvent;
import com.flagship.ad_escrow.campaign.ChannelRevocationHandler;
import com.flagship.ad_escrow.channel.Channel;
import com.flagship.ad_escrow.channel.ChannelService;
import com.flagship.ad_escrow.channel.ChannelStatus;
import com.flagship.ad_escrow.channel.ChannelVerifier;
import com.flagship.ad_escrow.error.InvalidTransitionException;
import com.flagship.ad_escrow.error.VerificationFailedException;
import com.flagship.ad_escrow.gateway.OutboundCallExecutor;
import com.flagship.ad_escrow.observability.EngineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PostingOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");

    private CampaignStateMachine stateMachine;
    private CampaignPersistenceService campaigns;
    private ChannelService channelService;
    private ChannelVerifier channelVerifier;
    private ChannelRevocationHandler revocationHandler;
    private PostingTransport transport;
    private OutboundCallExecutor outbound;
    private CampaignTaskRegistry tasks;
    private PostingOrchestrator orchestrator;

    private Channel channel;
    private Campaign accepted;

    @BeforeEach
    void setUp() {
        stateMachine = mock(CampaignStateMachine.class);
        campaigns = mock(CampaignPersistenceService.class);
        channelService = mock(ChannelService.class);
        channelVerifier = mock(ChannelVerifier.class);
        revocationHandler = mock(ChannelRevocationHandler.class);
        transport = mock(PostingTransport.class);
        tasks = mock(CampaignTaskRegistry.class);
        outbound = new OutboundCallExecutor(2);
        PostingPolicy policy = new PostingPolicy(3, Duration.ofSeconds(2), 2.0,
                Duration.ofSeconds(60), Duration.ofSeconds(1), 10, true);

        orchestrator = new PostingOrchestrator(stateMachine, campaigns, channelService, channelVerifier,
                revocationHandler, transport, outbound, tasks, policy, new EngineMetrics(new SimpleMeterRegistry()),
                Clock.fixed(NOW, ZoneOffset.UTC));

        UUID ownerId = UUID.randomUUID();
        channel = new Channel(UUID.randomUUID(), ownerId, "@news", "News", ChannelStatus.VERIFIED,
                1000, 100, NOW, NOW, NOW);
        accepted = Campaign.draft(UUID.randomUUID(), UUID.randomUUID(), "Buy widgets", 500,
                        Duration.ofHours(1), NOW, NOW.plus(Duration.ofDays(7)))
                .submit(NOW).fund(NOW).offer(NOW)
                .accept(ownerId, channel.getId(), NOW);

        when(campaigns.require(accepted.getId())).thenReturn(accepted);
        when(channelService.require(channel.getId())).thenReturn(channel);
    }

    @AfterEach
    void tearDown() {
        outbound.destroy();
    }

    @Nested
    @DisplayName("Posting")
    class Posting {

        @Test
        @DisplayName("Successful publish marks the campaign posted")
        void success() {
            when(transport.publish("@news", "Buy widgets")).thenReturn("@news/1");

            PostingResult result = orchestrator.post(accepted.getId());

            assertTrue(result.isPosted());
            assertEquals("@news/1", result.getPlacementRef());
            verify(stateMachine).markPosted(accepted.getId(), "@news/1");
        }

        @Test
        @DisplayName("Transient failure schedules the next attempt after backoff")
        void transientFailureRetries() {
            when(transport.publish(anyString(), anyString()))
                    .thenThrow(PostingTransportException.transientFailure("rate limited"));

            PostingResult result = orchestrator.post(accepted.getId());

            assertEquals(PostingResult.Outcome.RETRY_SCHEDULED, result.getOutcome());
            verify(tasks).schedule(eq(accepted.getId()), any(Runnable.class), eq(NOW.plusSeconds(2)));
            verify(stateMachine, never()).reoffer(any(), anyString());
        }

        @Test
        @DisplayName("Transient failure on the last attempt re-offers and penalizes the channel")
        void exhaustedRetries() {
            when(transport.publish(anyString(), anyString()))
                    .thenThrow(PostingTransportException.transientFailure("rate limited"));

            PostingResult result = orchestrator.attemptPost(accepted.getId(), 3);

            assertEquals(PostingResult.Outcome.FAILED, result.getOutcome());
            assertNotNull(result.getFailure());
            verify(stateMachine).reoffer(accepted.getId(), PostingOrchestrator.POSTING_FAILED_REASON);
            verify(channelVerifier).penalize(channel.getId(), 10);
            verify(tasks, never()).schedule(any(), any(), any());
        }

        @Test
        @DisplayName("Permanent failure is not retried")
        void permanentFailure() {
            when(transport.publish(anyString(), anyString()))
                    .thenThrow(PostingTransportException.permanentFailure("bot removed"));

            PostingResult result = orchestrator.post(accepted.getId());

            assertEquals(PostingResult.Outcome.FAILED, result.getOutcome());
            assertEquals(1, result.getAttempt());
            verify(stateMachine).reoffer(accepted.getId(), PostingOrchestrator.POSTING_FAILED_REASON);
        }

        @Test
        @DisplayName("Campaigns no longer accepted are skipped without publishing")
        void skippedWhenNotAccepted() {
            Campaign cancelled = accepted.systemCancel("gone", NOW);
            when(campaigns.require(accepted.getId())).thenReturn(cancelled);

            PostingResult result = orchestrator.post(accepted.getId());

            assertEquals(PostingResult.Outcome.SKIPPED, result.getOutcome());
            verify(transport, never()).publish(anyString(), anyString());
        }

        @Test
        @DisplayName("A placement whose campaign moved on is reported as skipped")
        void orphanedPlacement() {
            when(transport.publish(anyString(), anyString())).thenReturn("@news/7");
            when(stateMachine.markPosted(accepted.getId(), "@news/7"))
                    .thenThrow(new InvalidTransitionException("campaign expired"));

            assertEquals(PostingResult.Outcome.SKIPPED, orchestrator.post(accepted.getId()).getOutcome());
            verify(revocationHandler, never()).unbind(any(), anyString());
        }

        @Test
        @DisplayName("A channel that is no longer verified gets no publish and its campaign is unbound")
        void unverifiedChannelUnbinds() {
            Channel pending = new Channel(channel.getId(), channel.getOwnerId(), "@news", "News",
                    ChannelStatus.PENDING, 1000, 20, NOW, NOW, NOW);
            when(channelService.require(channel.getId())).thenReturn(pending);

            PostingResult result = orchestrator.post(accepted.getId());

            assertEquals(PostingResult.Outcome.SKIPPED, result.getOutcome());
            verify(transport, never()).publish(anyString(), anyString());
            verify(stateMachine, never()).markPosted(any(), anyString());
            verify(revocationHandler).unbind(accepted.getId(), PostingOrchestrator.CHANNEL_UNVERIFIED_REASON);
        }

        @Test
        @DisplayName("Verification lost during the publish unbinds the campaign")
        void verificationLostInFlight() {
            when(transport.publish(anyString(), anyString())).thenReturn("@news/9");
            when(stateMachine.markPosted(accepted.getId(), "@news/9"))
                    .thenThrow(new VerificationFailedException("Channel is PENDING, not VERIFIED"));

            assertEquals(PostingResult.Outcome.SKIPPED, orchestrator.post(accepted.getId()).getOutcome());
            verify(revocationHandler).unbind(accepted.getId(), PostingOrchestrator.CHANNEL_UNVERIFIED_REASON);
        }
    }

    @Nested
    @DisplayName("Recovery")
    class Recovery {

        @Test
        @DisplayName("A campaign that cannot be rescheduled does not stop the others")
        void failingCampaignIsolated() {
            Campaign broken = accepted.markPosted("@news/1", NOW);
            Campaign healthy = Campaign.draft(UUID.randomUUID(), UUID.randomUUID(), "Buy gadgets", 300,
                            Duration.ofHours(2), NOW, NOW.plus(Duration.ofDays(7)))
                    .submit(NOW).fund(NOW).offer(NOW)
                    .accept(channel.getOwnerId(), channel.getId(), NOW)
                    .markPosted("@news/2", NOW);
            when(campaigns.findIdsByStatus(CampaignStatus.ACCEPTED)).thenReturn(List.of());
            when(campaigns.findIdsByStatus(CampaignStatus.POSTED)).thenReturn(List.of(broken.getId(), healthy.getId()));
            when(campaigns.require(broken.getId())).thenThrow(new IllegalStateException("corrupt row"));
            when(campaigns.require(healthy.getId())).thenReturn(healthy);

            assertEquals(1, orchestrator.recoverStalled());
            verify(tasks).schedule(eq(healthy.getId()), any(Runnable.class), eq(NOW.plus(Duration.ofHours(2))));
            verify(tasks, never()).schedule(eq(broken.getId()), any(Runnable.class), any());
        }
    }

    @Nested
    @DisplayName("Confirmation")
    class Confirmation {

        private Campaign posted;

        @BeforeEach
        void postCampaign() {
            posted = accepted.markPosted("@news/1", NOW);
            when(campaigns.require(accepted.getId())).thenReturn(posted);
        }

        @Test
        @DisplayName("Present placement confirms the campaign")
        void presentConfirms() {
            when(transport.exists("@news/1")).thenReturn(true);

            assertTrue(orchestrator.confirmCompletion(posted.getId()));
            verify(stateMachine).confirm(posted.getId());
        }

        @Test
        @DisplayName("Missing placement refunds the advertiser")
        void missingRefunds() {
            when(transport.exists("@news/1")).thenReturn(false);

            assertFalse(orchestrator.confirmCompletion(posted.getId()));
            verify(stateMachine).failPlacement(posted.getId(), PostingOrchestrator.PLACEMENT_MISSING_REASON);
            verify(stateMachine, never()).confirm(any());
        }

        @Test
        @DisplayName("Unanswered checks are retried, then treated as removed")
        void uncheckablePlacement() {
            when(transport.exists("@news/1")).thenThrow(PostingTransportException.transientFailure("timeout"));

            assertFalse(orchestrator.attemptConfirm(posted.getId(), 1));
            verify(tasks).schedule(eq(posted.getId()), any(Runnable.class), eq(NOW.plusSeconds(2)));

            assertFalse(orchestrator.attemptConfirm(posted.getId(), 3));
            verify(stateMachine).failPlacement(posted.getId(), PostingOrchestrator.PLACEMENT_MISSING_REASON);
        }
    }

    @Nested
    @DisplayName("Transition listener")
    class TransitionListener {

        @Test
        @DisplayName("Acceptance schedules posting immediately")
        void acceptanceSchedulesPosting() {
            Campaign offered = accepted.reoffer("x", NOW);
            orchestrator.onCampaignTransitioned(new CampaignTransitionedEvent(offered, accepted));

            verify(tasks).schedule(eq(accepted.getId()), any(Runnable.class), eq(NOW));
        }

        @Test
        @DisplayName("Posting schedules confirmation at the end of the target duration")
        void postingSchedulesConfirmation() {
            Campaign posted = accepted.markPosted("@news/1", NOW);
            orchestrator.onCampaignTransitioned(new CampaignTransitionedEvent(accepted, posted));

            verify(tasks).schedule(eq(posted.getId()), any(Runnable.class), eq(NOW.plus(Duration.ofHours(1))));
        }

        @Test
        @DisplayName("Leaving ACCEPTED cancels pending tasks")
        void leavingAcceptedCancels() {
            Campaign cancelled = accepted.systemCancel("revoked", NOW);
            orchestrator.onCampaignTransitioned(new CampaignTransitionedEvent(accepted, cancelled));

            verify(tasks).cancel(accepted.getId());
        }
    }
}
