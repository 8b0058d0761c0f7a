package com.flagship.ad_escrow.campaign.event;

import com.flagship.ad_escrow.campaign.Campaign;
import com.flagship.ad_escrow.campaign.CampaignStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact recorded in the outbox for every committed campaign transition and
 * published to the campaigns topic keyed by campaign id.
 *
 * Consumers deduplicate on {@code eventId}.
 */
@Value
public class CampaignLifecycleEvent {

    public static final String EVENT_TYPE = "CampaignTransitioned";

    UUID eventId;
    String eventType;
    UUID campaignId;
    UUID advertiserId;
    UUID channelId;
    UUID channelOwnerId;
    CampaignStatus fromStatus;
    CampaignStatus toStatus;
    long budget;
    String placementRef;
    String failureReason;
    Instant occurredAt;

    /**
     * The channel binding of a re-offered campaign is already cleared on {@code after},
     * so the previous owner is taken from {@code before}.
     */
    public static CampaignLifecycleEvent of(Campaign before, Campaign after, Instant occurredAt) {
        UUID channelId = after.getChannelId() != null ? after.getChannelId() : before.getChannelId();
        UUID ownerId = after.getChannelOwnerId() != null ? after.getChannelOwnerId() : before.getChannelOwnerId();
        return new CampaignLifecycleEvent(
            UUID.randomUUID(),
            EVENT_TYPE,
            after.getId(),
            after.getAdvertiserId(),
            channelId,
            ownerId,
            before.getStatus(),
            after.getStatus(),
            after.getBudget(),
            after.getPlacementRef(),
            after.getFailureReason(),
            occurredAt
        );
    }
}
