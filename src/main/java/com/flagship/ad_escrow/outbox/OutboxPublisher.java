package com.flagship.ad_escrow.outbox;

import com.flagship.ad_escrow.observability.OutboxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Moves lifecycle events from the outbox to the campaigns topic.
 *
 * Records are keyed by campaign id and sent one at a time, each acknowledged by the broker
 * before the next, so a campaign's events reach its partition in transition order. An event
 * that keeps failing stops being picked up after {@code outbox.publisher.max-retries} attempts.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final String topic;
    private final int batchSize;
    private final int maxAttempts;
    private final Duration sendTimeout;

    public OutboxPublisher(OutboxService outboxService,
                           KafkaTemplate<String, String> kafkaTemplate,
                           OutboxMetrics outboxMetrics,
                           @Value("${kafka.topic.campaigns:campaigns}") String topic,
                           @Value("${outbox.publisher.batch-size:100}") int batchSize,
                           @Value("${outbox.publisher.max-retries:5}") int maxAttempts,
                           @Value("${outbox.publisher.send-timeout:PT10S}") Duration sendTimeout) {
        this.outboxService = outboxService;
        this.kafkaTemplate = kafkaTemplate;
        this.outboxMetrics = outboxMetrics;
        this.topic = topic;
        this.batchSize = batchSize;
        this.maxAttempts = maxAttempts;
        this.sendTimeout = sendTimeout;
    }

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval:PT1S}")
    public void publishBatch() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.nextBatch(batchSize, maxAttempts);
        } catch (RuntimeException e) {
            log.error("Could not read the outbox", e);
            return;
        }
        for (OutboxEvent event : batch) {
            if (!send(event)) {
                // keep per-campaign order: later events wait for the next poll
                break;
            }
        }
    }

    private boolean send(OutboxEvent event) {
        String failure;
        try {
            RecordMetadata metadata = kafkaTemplate
                    .send(topic, event.getCampaignId().toString(), event.getPayload())
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .getRecordMetadata();
            outboxService.markPublished(event.getId());
            outboxMetrics.recordPublished(event.getEventType());
            log.debug("Event {} sent to {}-{}@{}", event.getId(), metadata.topic(), metadata.partition(), metadata.offset());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = "Interrupted while sending";
        } catch (ExecutionException e) {
            failure = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
        } catch (TimeoutException e) {
            failure = "No broker acknowledgment within " + sendTimeout;
        }

        outboxMetrics.recordPublishFailed(event.getEventType());
        int attempts = outboxService.recordFailure(event.getId(), failure);
        if (attempts >= maxAttempts) {
            outboxMetrics.recordDeadLettered(event.getEventType());
            log.error("Event {} for campaign {} dead-lettered after {} attempts: {}",
                    event.getId(), event.getCampaignId(), attempts, failure);
        }
        return false;
    }
}
