package com.flagship.ad_escrow.channel;

import lombok.Value;

@Value
public class ChannelProbeResult {
    boolean botIsAdmin;
    int subscriberCount;

    public static ChannelProbeResult admin(int subscriberCount) {
        return new ChannelProbeResult(true, subscriberCount);
    }

    public static ChannelProbeResult notAdmin() {
        return new ChannelProbeResult(false, 0);
    }
}
