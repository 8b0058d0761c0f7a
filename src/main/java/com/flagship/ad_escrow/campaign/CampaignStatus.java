package com.flagship.ad_escrow.campaign;

public enum CampaignStatus {
    DRAFT,
    PENDING_FUNDING,
    FUNDED,
    OFFERED,
    ACCEPTED,
    POSTED,
    CONFIRMED,
    CANCELLED,
    REFUNDED,
    EXPIRED;

    public boolean isTerminal() {
        return this == CONFIRMED || this == CANCELLED || this == REFUNDED || this == EXPIRED;
    }

    /**
     * States in which the advertiser's budget sits in escrow.
     */
    public boolean holdsFunds() {
        return this == FUNDED || this == OFFERED || this == ACCEPTED || this == POSTED;
    }

    /**
     * States that the expiry sweep moves to EXPIRED once the deadline passes.
     */
    public boolean isExpirable() {
        return this == FUNDED || this == OFFERED || this == ACCEPTED;
    }

    public boolean isAdvertiserCancellable() {
        return this == DRAFT || this == PENDING_FUNDING || this == FUNDED || this == OFFERED;
    }
}
