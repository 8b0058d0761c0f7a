package com.flagship.ad_escrow.observability;

import com.flagship.ad_escrow.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lifecycle-event outbox as Micrometer meters.
 *
 * Gauges read snapshots taken by {@link #refresh()}, so a scrape never touches the database.
 */
@Component
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int maxRetries;

    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong oldestPendingSeconds = new AtomicLong();
    private final AtomicLong stuck = new AtomicLong();

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry meterRegistry,
                         Clock clock,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.maxRetries = maxRetries;

        Gauge.builder("escrow.outbox.pending", pending, AtomicLong::get)
                .description("Lifecycle events not yet on the campaigns topic")
                .register(meterRegistry);
        Gauge.builder("escrow.outbox.oldest_pending.seconds", oldestPendingSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished lifecycle event")
                .register(meterRegistry);
        Gauge.builder("escrow.outbox.stuck", stuck, AtomicLong::get)
                .description("Unpublished events past the publisher's retry ceiling")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.outbox-refresh-interval:PT15S}")
    @Transactional(readOnly = true)
    public void refresh() {
        try {
            Instant now = clock.instant();
            pending.set(outboxRepository.countUnpublished());
            oldestPendingSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, now).getSeconds()))
                    .orElse(0L));
            stuck.set(outboxRepository.countDeadLettered(maxRetries));
        } catch (DataAccessException e) {
            log.warn("Outbox metrics not refreshed: {}", e.getMessage());
        }
    }

    public long pendingEvents() {
        return pending.get();
    }

    public void recordPublished(String eventType) {
        meterRegistry.counter("escrow.outbox.published", "event_type", eventType, "outcome", "sent").increment();
    }

    public void recordPublishFailed(String eventType) {
        meterRegistry.counter("escrow.outbox.published", "event_type", eventType, "outcome", "failed").increment();
    }

    public void recordDeadLettered(String eventType) {
        meterRegistry.counter("escrow.outbox.dead_lettered", "event_type", eventType).increment();
    }
}
