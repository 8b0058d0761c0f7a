package com.flagship.ad_escrow.posting;

/**
 * Publishes ads to a channel on the chat platform.
 */
public interface PostingTransport {

    /**
     * Publishes (and pins) the ad in the channel.
     *
     * @return reference of the placed message
     * @throws PostingTransportException if the platform rejected or failed the call
     */
    String publish(String channelExternalId, String content);

    /**
     * Whether the placement is still live in its channel.
     *
     * @throws PostingTransportException if the platform could not be asked
     */
    boolean exists(String placementRef);
}
