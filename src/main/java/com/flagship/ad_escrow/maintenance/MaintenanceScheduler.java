package com.flagship.ad_escrow.maintenance;

import com.flagship.ad_escrow.consumer.IdempotentEventProcessor;
import com.flagship.ad_escrow.posting.PostingOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

@Component
@ConditionalOnProperty(name = "campaign.maintenance.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class MaintenanceScheduler {

    private final CampaignMaintenanceService maintenanceService;
    private final PostingOrchestrator postingOrchestrator;
    private final IdempotentEventProcessor eventProcessor;
    private final Clock clock;
    private final Duration processedEventRetention;

    public MaintenanceScheduler(CampaignMaintenanceService maintenanceService,
                                PostingOrchestrator postingOrchestrator,
                                IdempotentEventProcessor eventProcessor,
                                Clock clock,
                                @Value("${consumer.processed-event-retention:P30D}") Duration processedEventRetention) {
        this.maintenanceService = maintenanceService;
        this.postingOrchestrator = postingOrchestrator;
        this.eventProcessor = eventProcessor;
        this.clock = clock;
        this.processedEventRetention = processedEventRetention;
    }

    @Scheduled(fixedDelayString = "${campaign.maintenance.interval:PT60S}",
               initialDelayString = "${campaign.maintenance.initial-delay:PT30S}")
    public void sweepCampaigns() {
        try {
            maintenanceService.expireDueCampaigns();
            maintenanceService.offerStalledCampaigns();
        } catch (RuntimeException e) {
            log.error("Campaign sweep failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${posting.recovery-interval:PT2M}",
               initialDelayString = "${posting.recovery-initial-delay:PT10S}")
    public void recoverPostingTasks() {
        try {
            postingOrchestrator.recoverStalled();
        } catch (RuntimeException e) {
            log.error("Posting recovery failed", e);
        }
    }

    @Scheduled(cron = "${consumer.processed-event-purge-cron:0 30 3 * * *}")
    public void purgeProcessedEvents() {
        eventProcessor.purgeRecordedBefore(clock.instant().minus(processedEventRetention));
    }
}
