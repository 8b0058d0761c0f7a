package com.flagship.ad_escrow.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.ad_escrow.campaign.event.CampaignLifecycleEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Queue of lifecycle events between the state machine and Kafka.
 *
 * An event is appended in the transaction of the transition it describes, so it exists
 * if and only if the transition committed. Sending is {@link OutboxPublisher}'s job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Must join the caller's transaction; there is no outbox write on its own.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent append(CampaignLifecycleEvent event) {
        OutboxEventEntity entity = new OutboxEventEntity(event.getEventId(), event.getCampaignId(),
                event.getEventType(), toJson(event), clock.instant());
        repository.save(entity);
        log.debug("Queued {} {} -> {} as event {}",
                event.getEventType(), event.getFromStatus(), event.getToStatus(), event.getEventId());
        return entity.toOutboxEvent();
    }

    /**
     * Locks the next batch for this publisher. The locks last only as long as this call.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> nextBatch(int batchSize, int maxAttempts) {
        return repository.lockSendable(batchSize, maxAttempts).stream()
                .map(OutboxEventEntity::toOutboxEvent)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> entity.published(clock.instant()));
    }

    /**
     * @return attempts made so far, including this one
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int recordFailure(UUID eventId, String error) {
        return repository.findById(eventId).map(entity -> {
            entity.sendFailed(error);
            log.warn("Send of event {} failed (attempt {}): {}", eventId, entity.getAttempts(), error);
            return entity.getAttempts();
        }).orElse(0);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> eventsFor(UUID campaignId) {
        return repository.findByCampaignIdOrderBySequenceNumberAsc(campaignId).stream()
                .map(OutboxEventEntity::toOutboxEvent)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String toJson(CampaignLifecycleEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Lifecycle event " + event.getEventId() + " is not serializable", e);
        }
    }
}
