package com.flagship.ad_escrow.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the campaign engine.
 *
 * Metrics exposed:
 * - campaign.transitions: counter tagged with from/to status
 * - escrow.operations: counter tagged with operation (hold, release, refund) and result
 * - ledger.transactions: counter tagged with kind and result
 * - posting.attempts / posting.confirmations: counters tagged with outcome
 * - channel.verifications: counter tagged with resulting status
 * - commands.latency: timer tagged with command name
 */
@Component
public class EngineMetrics {

    private final MeterRegistry registry;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String from, String to) {
        registry.counter("campaign.transitions",
                "from", sanitizeTag(from),
                "to", sanitizeTag(to)
        ).increment();
    }

    public void recordEscrowOperation(String operation, String result) {
        registry.counter("escrow.operations",
                "operation", sanitizeTag(operation),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordLedgerTransaction(String kind, String result) {
        registry.counter("ledger.transactions",
                "kind", sanitizeTag(kind),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordPostingAttempt(String outcome) {
        registry.counter("posting.attempts", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordConfirmation(String outcome) {
        registry.counter("posting.confirmations", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordVerification(String status) {
        registry.counter("channel.verifications", "status", sanitizeTag(status)).increment();
    }

    public void recordCommandLatency(String command, long durationMs) {
        registry.timer("commands.latency", "command", sanitizeTag(command))
                .record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag values short and free of punctuation so cardinality stays bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_").toLowerCase();
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
