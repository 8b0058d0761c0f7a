package com.flagship.ad_escrow.channel;

/**
 * The platform could not be asked about the channel. Never means "not admin".
 */
public class ChannelProbeException extends RuntimeException {

    public ChannelProbeException(String message) {
        super(message);
    }

    public ChannelProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
