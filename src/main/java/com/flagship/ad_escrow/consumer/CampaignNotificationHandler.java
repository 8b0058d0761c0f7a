package com.flagship.ad_escrow.consumer;

import com.flagship.ad_escrow.campaign.event.CampaignLifecycleEvent;
import com.flagship.ad_escrow.channel.Channel;
import com.flagship.ad_escrow.channel.ChannelService;
import com.flagship.ad_escrow.messaging.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Tells advertisers and channel owners what happened to their campaigns.
 * Called by {@link CampaignEventConsumer} once deduplication has passed.
 */
@Service
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CampaignNotificationHandler {

    private final NotificationService notificationService;
    private final ChannelService channelService;

    public void onCampaignTransitioned(CampaignLifecycleEvent event) {
        log.info("Handling {}: campaignId={}, {} -> {}",
                event.getEventType(), event.getCampaignId(), event.getFromStatus(), event.getToStatus());

        String channelTitle = event.getChannelId() == null ? null
                : channelService.findById(event.getChannelId()).map(Channel::getTitle).orElse(null);
        int delivered = notificationService.notifyTransition(event, channelTitle);

        log.debug("Delivered {} notification(s) for campaign {}", delivered, event.getCampaignId());
    }
}
