package com.flagship.ad_escrow.campaign;

import lombok.Value;

/**
 * In-process signal of a campaign transition, delivered to listeners after commit.
 * Drives the scheduling of posting and confirmation tasks.
 */
@Value
public class CampaignTransitionedEvent {
    Campaign before;
    Campaign after;

    public CampaignStatus getFromStatus() {
        return before.getStatus();
    }

    public CampaignStatus getToStatus() {
        return after.getStatus();
    }
}
