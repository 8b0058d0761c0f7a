package com.flagship.ad_escrow.channel;

public enum ChannelStatus {
    UNVERIFIED,
    PENDING,
    VERIFIED,
    REVOKED
}
