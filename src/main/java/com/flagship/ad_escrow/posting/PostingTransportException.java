package com.flagship.ad_escrow.posting;

/**
 * Failure reported by a {@link PostingTransport}.
 * Transient failures (rate limits, timeouts, outages) are retried; permanent ones
 * (bot removed, channel gone) are not.
 */
public class PostingTransportException extends RuntimeException {

    private final boolean transientFailure;

    public PostingTransportException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public PostingTransportException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static PostingTransportException transientFailure(String message) {
        return new PostingTransportException(message, true);
    }

    public static PostingTransportException permanentFailure(String message) {
        return new PostingTransportException(message, false);
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
