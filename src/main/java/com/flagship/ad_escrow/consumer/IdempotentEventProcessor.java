package com.flagship.ad_escrow.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Runs a handler at most once per (event, consumer group).
 *
 * The dedup row shares the handler's transaction: a crash before commit leaves the
 * event unrecorded and the redelivery runs it again. A failing handler rolls back and
 * rethrows, so the message is not acknowledged. Two concurrent deliveries race on the
 * primary key and the loser rolls back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final Clock clock;

    /**
     * @return true if the handler ran, false for a duplicate delivery
     */
    @Transactional
    public boolean handleOnce(UUID eventId, UUID campaignId, String eventType,
                              String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Duplicate delivery of event {} to {}, ignoring", eventId, consumerGroup);
            return false;
        }
        handler.run();
        repository.save(new ProcessedEventEntity(
            ProcessedEvent.handled(eventId, campaignId, eventType, consumerGroup, clock.instant())));
        return true;
    }

    @Transactional
    public void recordIgnored(UUID eventId, UUID campaignId, String eventType,
                              String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(new ProcessedEventEntity(
            ProcessedEvent.ignored(eventId, campaignId, eventType, consumerGroup, reason, clock.instant())));
        log.debug("Ignored event {} ({}): {}", eventId, eventType, reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    /**
     * Events recorded for one campaign, oldest first.
     */
    @Transactional(readOnly = true)
    public List<ProcessedEvent> history(UUID campaignId) {
        return repository.findByCampaignIdOrderByRecordedAtAsc(campaignId).stream()
            .map(ProcessedEventEntity::toProcessedEvent)
            .toList();
    }

    /**
     * Replays of events recorded before {@code cutoff} are no longer detected afterwards.
     */
    @Transactional
    public int purgeRecordedBefore(Instant cutoff) {
        int deleted = repository.deleteRecordedBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} dedup record(s) older than {}", deleted, cutoff);
        }
        return deleted;
    }
}
