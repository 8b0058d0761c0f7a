package com.flagship.ad_escrow.channel;

import lombok.Value;

import java.util.UUID;

/**
 * In-process notification that a channel's verification status changed.
 * Published inside the verifying transaction; listeners react after commit.
 */
@Value
public class ChannelStatusChangedEvent {
    UUID channelId;
    UUID ownerId;
    ChannelStatus previousStatus;
    ChannelStatus newStatus;

    public boolean isRevocation() {
        return newStatus == ChannelStatus.REVOKED && previousStatus != ChannelStatus.REVOKED;
    }
}
