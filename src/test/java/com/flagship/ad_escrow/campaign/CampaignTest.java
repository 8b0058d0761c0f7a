package com.flagship.ad_escrow.campaign;

import com.flagship.ad_escrow.error.AlreadyClaimedException;
import com.flagship.ad_escrow.error.CampaignExpiredException;
import com.flagship.ad_escrow.error.InvalidTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CampaignTest {

    private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");
    private static final Instant EXPIRES = NOW.plus(Duration.ofDays(7));

    private final UUID advertiserId = UUID.randomUUID();
    private final UUID ownerId = UUID.randomUUID();
    private final UUID channelId = UUID.randomUUID();

    private Campaign draft(long budget, String content) {
        return Campaign.draft(UUID.randomUUID(), advertiserId, content, budget, Duration.ofHours(1), NOW, EXPIRES);
    }

    private Campaign offered() {
        return draft(500, "Buy our widgets").submit(NOW).fund(NOW).offer(NOW);
    }

    @Test
    @DisplayName("Happy path walks DRAFT through CONFIRMED")
    void happyPath() {
        Campaign campaign = offered()
            .accept(ownerId, channelId, NOW)
            .markPosted("chan/1", NOW.plusSeconds(60))
            .confirm(NOW.plus(Duration.ofHours(2)));

        assertEquals(CampaignStatus.CONFIRMED, campaign.getStatus());
        assertEquals(channelId, campaign.getChannelId());
        assertEquals(ownerId, campaign.getChannelOwnerId());
        assertEquals("chan/1", campaign.getPlacementRef());
        assertTrue(campaign.isTerminal());
    }

    @Test
    @DisplayName("Submit requires a positive budget and content")
    void submitGuards() {
        assertThrows(InvalidTransitionException.class, () -> draft(0, "content").submit(NOW));
        assertThrows(InvalidTransitionException.class, () -> draft(100, "   ").submit(NOW));
        assertEquals(CampaignStatus.PENDING_FUNDING, draft(1, "x").submit(NOW).getStatus());
    }

    @Test
    @DisplayName("Draft rejects a non-positive duration or a past expiry")
    void draftValidation() {
        assertThrows(IllegalArgumentException.class, () ->
            Campaign.draft(UUID.randomUUID(), advertiserId, "x", 10, Duration.ZERO, NOW, EXPIRES));
        assertThrows(IllegalArgumentException.class, () ->
            Campaign.draft(UUID.randomUUID(), advertiserId, "x", 10, Duration.ofHours(1), NOW, NOW));
    }

    @Test
    @DisplayName("Draft caps the target duration at a week")
    void draftDurationCap() {
        assertDoesNotThrow(() ->
            Campaign.draft(UUID.randomUUID(), advertiserId, "x", 10, Campaign.MAX_TARGET_DURATION, NOW, EXPIRES));
        assertThrows(IllegalArgumentException.class, () ->
            Campaign.draft(UUID.randomUUID(), advertiserId, "x", 10, Duration.ofMinutes(10_000_000_000_000_000L), NOW, EXPIRES));
    }

    @Test
    @DisplayName("Accepting a claimed campaign fails with AlreadyClaimed")
    void secondClaimFails() {
        Campaign accepted = offered().accept(ownerId, channelId, NOW);

        assertThrows(AlreadyClaimedException.class,
            () -> accepted.accept(UUID.randomUUID(), UUID.randomUUID(), NOW));
    }

    @Test
    @DisplayName("Accept rejects the advertiser, excluded owners and expired campaigns")
    void acceptGuards() {
        Campaign campaign = offered();

        assertThrows(InvalidTransitionException.class, () -> campaign.accept(advertiserId, channelId, NOW));
        assertThrows(CampaignExpiredException.class, () -> campaign.accept(ownerId, channelId, EXPIRES));

        Campaign reoffered = campaign.accept(ownerId, channelId, NOW).reoffer("Channel revoked", NOW);
        assertThrows(InvalidTransitionException.class, () -> reoffered.accept(ownerId, channelId, NOW));
    }

    @Test
    @DisplayName("Re-offer unbinds the channel and excludes its owner")
    void reofferExcludesOwner() {
        Campaign reoffered = offered().accept(ownerId, channelId, NOW).reoffer("Posting failed", NOW);

        assertEquals(CampaignStatus.OFFERED, reoffered.getStatus());
        assertNull(reoffered.getChannelId());
        assertNull(reoffered.getChannelOwnerId());
        assertTrue(reoffered.isExcluded(ownerId));
        assertEquals("Posting failed", reoffered.getFailureReason());

        UUID otherOwner = UUID.randomUUID();
        Campaign claimedAgain = reoffered.accept(otherOwner, UUID.randomUUID(), NOW);
        assertEquals(otherOwner, claimedAgain.getChannelOwnerId());
        assertTrue(claimedAgain.isExcluded(ownerId), "exclusions survive later claims");
        assertThrows(UnsupportedOperationException.class,
            () -> claimedAgain.getExcludedOwnerIds().add(UUID.randomUUID()));
    }

    @Test
    @DisplayName("Advertiser cancel is only allowed before acceptance")
    void cancelWindow() {
        assertEquals(CampaignStatus.CANCELLED, draft(10, "x").cancel(NOW).getStatus());
        assertEquals(CampaignStatus.CANCELLED, offered().cancel(NOW).getStatus());

        Campaign accepted = offered().accept(ownerId, channelId, NOW);
        assertThrows(InvalidTransitionException.class, () -> accepted.cancel(NOW));
        assertEquals(CampaignStatus.CANCELLED, accepted.systemCancel("Channel revoked", NOW).getStatus());
    }

    @Test
    @DisplayName("Expire requires an expirable status and a passed deadline")
    void expireGuards() {
        Campaign campaign = offered();

        assertThrows(InvalidTransitionException.class, () -> campaign.expire(NOW));
        assertEquals(CampaignStatus.EXPIRED, campaign.expire(EXPIRES).getStatus());

        Campaign posted = campaign.accept(ownerId, channelId, NOW).markPosted("chan/9", NOW);
        assertThrows(InvalidTransitionException.class, () -> posted.expire(EXPIRES.plusSeconds(1)));
    }

    @Test
    @DisplayName("Confirmation is due target duration after posting")
    void confirmationDueAt() {
        Instant postedAt = NOW.plusSeconds(30);
        Campaign posted = offered().accept(ownerId, channelId, NOW).markPosted("chan/2", postedAt);

        assertEquals(postedAt.plus(Duration.ofHours(1)), posted.confirmationDueAt());
        assertThrows(IllegalStateException.class, () -> offered().confirmationDueAt());
    }

    @Test
    @DisplayName("Placement failure refunds only from POSTED")
    void failPlacement() {
        Campaign accepted = offered().accept(ownerId, channelId, NOW);
        assertThrows(InvalidTransitionException.class, () -> accepted.failPlacement("gone", NOW));

        Campaign refunded = accepted.markPosted("chan/3", NOW).failPlacement("gone", NOW);
        assertEquals(CampaignStatus.REFUNDED, refunded.getStatus());
        assertEquals("gone", refunded.getFailureReason());
    }

    @Test
    @DisplayName("Terminal campaigns allow no further transitions")
    void terminalStates() {
        Campaign cancelled = offered().cancel(NOW);

        for (CampaignStatus target : CampaignStatus.values()) {
            if (target != CampaignStatus.CANCELLED) {
                assertFalse(cancelled.canTransitionTo(target), "CANCELLED -> " + target);
            }
        }
        assertThrows(InvalidTransitionException.class, () -> cancelled.offer(NOW));
    }
}
