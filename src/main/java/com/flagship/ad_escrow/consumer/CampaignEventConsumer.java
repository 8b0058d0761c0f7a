package com.flagship.ad_escrow.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.ad_escrow.campaign.event.CampaignLifecycleEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Consumes campaign lifecycle events from the campaigns topic.
 *
 * Offsets are acknowledged manually after the handler and its dedup record commit.
 * Unparseable messages are acknowledged and dropped; handler failures are not
 * acknowledged, so the message is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CampaignEventConsumer {

    static final String CONSUMER_GROUP = "campaign-notification-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final CampaignNotificationHandler notificationHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.campaigns:campaigns}",
        groupId = "${spring.kafka.consumer.group-id:ad-escrow-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Could not parse event, acknowledging to skip: offset={}", record.offset());
            ack.acknowledge();
            return;
        }

        try {
            boolean processed = route(envelope, record.value());
            ack.acknowledge();
            if (processed) {
                log.info("Processed event: type={}, eventId={}, campaignId={}",
                        envelope.eventType(), envelope.eventId(), envelope.campaignId());
            }
        } catch (RuntimeException e) {
            log.error("Error processing message at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        }
    }

    private boolean route(EventEnvelope envelope, String rawPayload) {
        if (!CampaignLifecycleEvent.EVENT_TYPE.equals(envelope.eventType())) {
            eventProcessor.recordIgnored(envelope.eventId(), envelope.campaignId(), envelope.eventType(),
                    CONSUMER_GROUP, "Unknown event type");
            return false;
        }
        return eventProcessor.handleOnce(envelope.eventId(), envelope.campaignId(), envelope.eventType(),
                CONSUMER_GROUP, () -> notificationHandler.onCampaignTransitioned(deserialize(rawPayload)));
    }

    private EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            return new EventEnvelope(
                UUID.fromString(node.get("eventId").asText()),
                UUID.fromString(node.get("campaignId").asText()),
                node.path("eventType").asText("Unknown"));
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private CampaignLifecycleEvent deserialize(String json) {
        try {
            return objectMapper.readValue(json, CampaignLifecycleEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize event: " + e.getMessage(), e);
        }
    }

    private record EventEnvelope(UUID eventId, UUID campaignId, String eventType) {}
}
