package com.flagship.ad_escrow.posting;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PostingPolicyTest {

    private final PostingPolicy policy = new PostingPolicy(5, Duration.ofSeconds(2), 2.0,
            Duration.ofSeconds(60), Duration.ofSeconds(10), 10, true);

    @Test
    @DisplayName("Backoff grows geometrically and is capped")
    void backoff() {
        assertEquals(Duration.ofSeconds(2), policy.backoffFor(1));
        assertEquals(Duration.ofSeconds(4), policy.backoffFor(2));
        assertEquals(Duration.ofSeconds(8), policy.backoffFor(3));
        assertEquals(Duration.ofSeconds(32), policy.backoffFor(5));
        assertEquals(Duration.ofSeconds(60), policy.backoffFor(6));
        assertEquals(Duration.ofSeconds(60), policy.backoffFor(40));
    }

    @Test
    @DisplayName("Attempts stop at the ceiling")
    void attemptCeiling() {
        assertTrue(policy.hasAttemptsLeft(4));
        assertFalse(policy.hasAttemptsLeft(5));
    }

    @Test
    @DisplayName("Invalid settings are rejected")
    void invalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new PostingPolicy(0, Duration.ofSeconds(1), 2.0,
                Duration.ofSeconds(1), Duration.ofSeconds(1), 1, true));
        assertThrows(IllegalArgumentException.class, () -> new PostingPolicy(1, Duration.ofSeconds(1), 0.5,
                Duration.ofSeconds(1), Duration.ofSeconds(1), 1, true));
        assertThrows(IllegalArgumentException.class, () -> policy.backoffFor(0));
    }
}
