package com.flagship.ad_escrow.channel;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of one verification run.
 * {@code reason} explains why the channel is not VERIFIED; null when it is.
 */
@Value
public class VerificationResult {
    UUID channelId;
    ChannelStatus previousStatus;
    ChannelStatus status;
    boolean probeAvailable;
    int subscriberCount;
    int trustScore;
    String reason;

    public boolean isVerified() {
        return status == ChannelStatus.VERIFIED;
    }

    public boolean isStatusChanged() {
        return previousStatus != status;
    }
}
