package com.flagship.ad_escrow.posting;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Retry and timing settings for posting and confirmation.
 */
@Component
@Getter
public class PostingPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;
    private final Duration publishTimeout;
    private final int trustPenalty;
    private final boolean autoStart;

    public PostingPolicy(@Value("${posting.max-attempts:5}") int maxAttempts,
                         @Value("${posting.initial-backoff:PT2S}") Duration initialBackoff,
                         @Value("${posting.multiplier:2.0}") double multiplier,
                         @Value("${posting.max-backoff:PT60S}") Duration maxBackoff,
                         @Value("${posting.publish-timeout:PT10S}") Duration publishTimeout,
                         @Value("${posting.trust-penalty:10}") int trustPenalty,
                         @Value("${posting.auto-start:true}") boolean autoStart) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("posting.max-attempts must be at least 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("posting.multiplier must be at least 1.0");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff;
        this.publishTimeout = publishTimeout;
        this.trustPenalty = trustPenalty;
        this.autoStart = autoStart;
    }

    /**
     * Delay before the attempt after {@code attempt}: initial * multiplier^(attempt-1), capped.
     */
    public Duration backoffFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt numbers start at 1: " + attempt);
        }
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 1);
        if (millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }

    public boolean hasAttemptsLeft(int attempt) {
        return attempt < maxAttempts;
    }
}
