package com.flagship.ad_escrow.channel;

/**
 * Chat platform capability used to check that the bot administers a channel.
 */
public interface ChannelProbe {

    /**
     * @throws ChannelProbeException when the platform cannot answer right now
     */
    ChannelProbeResult probe(String channelExternalId);
}
