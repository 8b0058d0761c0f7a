package com.flagship.ad_escrow.user;

public enum UserRole {
    ADVERTISER,
    CHANNEL_OWNER,
    BOTH;

    public boolean canAdvertise() {
        return this == ADVERTISER || this == BOTH;
    }

    public boolean canOwnChannels() {
        return this == CHANNEL_OWNER || this == BOTH;
    }
}
