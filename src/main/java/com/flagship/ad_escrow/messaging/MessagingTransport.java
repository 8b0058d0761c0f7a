package com.flagship.ad_escrow.messaging;

import java.util.UUID;

/**
 * Delivers direct messages to users of the chat platform.
 */
public interface MessagingTransport {

    /**
     * @return true if the platform accepted the message
     */
    boolean send(UUID userId, String content);
}
