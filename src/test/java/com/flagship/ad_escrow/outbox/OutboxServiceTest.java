package com.flagship.ad_escrow.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.ad_escrow.campaign.Campaign;
import com.flagship.ad_escrow.campaign.CampaignStatus;
import com.flagship.ad_escrow.campaign.event.CampaignLifecycleEvent;
import com.flagship.ad_escrow.support.IntegrationTestBase;
import com.flagship.ad_escrow.user.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Every committed campaign transition leaves exactly one event in the outbox.
 */
class OutboxServiceTest extends IntegrationTestBase {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID advertiserId;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();
        advertiserId = newUser(UserRole.ADVERTISER).getId();
        topUp(advertiserId, 1000);
    }

    @Test
    @DisplayName("Create, fund and offer write one event per transition, in order")
    void transitionsWriteEvents() throws Exception {
        Campaign campaign = offeredCampaign(advertiserId, 300);

        List<OutboxEvent> events = outboxService.eventsFor(campaign.getId());

        assertEquals(3, events.size());
        CampaignLifecycleEvent funded = objectMapper.readValue(events.get(1).getPayload(), CampaignLifecycleEvent.class);
        assertEquals(CampaignStatus.PENDING_FUNDING, funded.getFromStatus());
        assertEquals(CampaignStatus.FUNDED, funded.getToStatus());
        assertEquals(300, funded.getBudget());
        assertEquals(CampaignLifecycleEvent.EVENT_TYPE, events.get(2).getEventType());
        assertTrue(events.stream().noneMatch(OutboxEvent::isPublished));
    }

    @Test
    @DisplayName("A rejected transition writes no event")
    void rejectedTransitionWritesNothing() {
        Campaign created = commands.createCampaign(advertiserId, "Too expensive", 5000, null,
                UUID.randomUUID().toString()).getCampaign();

        assertThrows(RuntimeException.class, () -> commands.fundCampaign(advertiserId, created.getId()));

        assertEquals(1, outboxService.eventsFor(created.getId()).size());
    }

    @Test
    @DisplayName("Published events leave the backlog")
    void markPublished() {
        offeredCampaign(advertiserId, 100);
        long backlog = outboxService.countUnpublished();

        OutboxEvent event = outboxService.nextBatch(10, 5).get(0);
        outboxService.markPublished(event.getId());

        assertEquals(backlog - 1, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Failed sends are counted until the event is dead-lettered")
    void recordFailure() {
        offeredCampaign(advertiserId, 100);
        OutboxEvent event = outboxService.nextBatch(10, 5).get(0);

        outboxService.recordFailure(event.getId(), "Broker not available");
        outboxService.recordFailure(event.getId(), "Broker not available");
        int attempts = outboxService.recordFailure(event.getId(), "Leader not available");

        OutboxEvent failed = outboxService.eventsFor(event.getCampaignId()).stream()
                .filter(e -> e.getId().equals(event.getId()))
                .findFirst().orElseThrow();
        assertEquals(3, attempts);
        assertEquals("Leader not available", failed.getLastError());
        assertTrue(failed.isDeadLettered(3));
        assertTrue(outboxService.nextBatch(10, 3).stream()
                .noneMatch(e -> e.getId().equals(event.getId())));
    }

    @Test
    @DisplayName("Outbox events carry the lifecycle event id consumers deduplicate on")
    void outboxIdIsEventId() throws Exception {
        Campaign campaign = offeredCampaign(advertiserId, 200);

        for (OutboxEvent event : outboxService.eventsFor(campaign.getId())) {
            CampaignLifecycleEvent payload = objectMapper.readValue(event.getPayload(), CampaignLifecycleEvent.class);
            assertEquals(event.getId(), payload.getEventId());
            assertEquals(campaign.getId(), payload.getCampaignId());
        }
    }

    @Test
    @DisplayName("Appending an event outside a transaction is refused")
    void appendRequiresTransaction() {
        Campaign campaign = offeredCampaign(advertiserId, 100);
        CampaignLifecycleEvent event = CampaignLifecycleEvent.of(campaign, campaign, clock.instant());

        assertThrows(IllegalTransactionStateException.class, () -> outboxService.append(event));
    }
}
