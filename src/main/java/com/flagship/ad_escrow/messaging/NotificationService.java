package com.flagship.ad_escrow.messaging;

import com.flagship.ad_escrow.campaign.CampaignStatus;
import com.flagship.ad_escrow.campaign.event.CampaignLifecycleEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Renders lifecycle messages for advertisers and channel owners.
 *
 * Delivery is best effort: a failed send is logged and reported as not delivered,
 * never thrown back to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final MessagingTransport transport;

    /**
     * Sends the messages for one campaign transition.
     *
     * @param channelTitle title of the bound channel, or null when unknown
     * @return number of messages delivered
     */
    public int notifyTransition(CampaignLifecycleEvent event, String channelTitle) {
        int delivered = 0;
        for (Message message : messagesFor(event, channelTitle != null ? channelTitle : "the channel")) {
            if (send(message.recipient(), message.content())) {
                delivered++;
            }
        }
        return delivered;
    }

    public boolean send(UUID userId, String content) {
        if (userId == null) {
            return false;
        }
        try {
            boolean sent = transport.send(userId, content);
            if (!sent) {
                log.warn("Message to user {} was not accepted", userId);
            }
            return sent;
        } catch (RuntimeException e) {
            log.error("Failed to send message to user {}: {}", userId, e.getMessage());
            return false;
        }
    }

    List<Message> messagesFor(CampaignLifecycleEvent event, String channel) {
        String campaign = shortId(event.getCampaignId());
        List<Message> messages = new ArrayList<>();
        switch (event.getToStatus()) {
            case FUNDED -> messages.add(new Message(event.getAdvertiserId(), String.format(
                "Campaign %s is funded. %d is held in escrow until the ad completes.", campaign, event.getBudget())));
            case OFFERED -> {
                if (event.getFromStatus() == CampaignStatus.ACCEPTED) {
                    messages.add(new Message(event.getAdvertiserId(), String.format(
                        "Campaign %s is back on offer: %s.", campaign, event.getFailureReason())));
                    messages.add(new Message(event.getChannelOwnerId(), String.format(
                        "Campaign %s was withdrawn from %s: %s.", campaign, channel, event.getFailureReason())));
                }
            }
            case ACCEPTED -> messages.add(new Message(event.getAdvertiserId(), String.format(
                "Campaign %s was accepted by %s. Funds stay in escrow; the ad will be posted shortly.",
                campaign, channel)));
            case POSTED -> {
                messages.add(new Message(event.getAdvertiserId(), String.format(
                    "Campaign %s is live on %s. You will be notified when it completes.", campaign, channel)));
                messages.add(new Message(event.getChannelOwnerId(), String.format(
                    "Campaign %s was posted to %s. Keep the ad pinned for the full duration to receive %d.",
                    campaign, channel, event.getBudget())));
            }
            case CONFIRMED -> {
                messages.add(new Message(event.getAdvertiserId(), String.format(
                    "Campaign %s on %s completed. %d was released to the channel owner.",
                    campaign, channel, event.getBudget())));
                messages.add(new Message(event.getChannelOwnerId(), String.format(
                    "Payment received: %d for campaign %s has been added to your balance.",
                    event.getBudget(), campaign)));
            }
            case REFUNDED -> {
                messages.add(new Message(event.getAdvertiserId(), String.format(
                    "Campaign %s failed: %s. %d was returned to your balance.",
                    campaign, event.getFailureReason(), event.getBudget())));
                messages.add(new Message(event.getChannelOwnerId(), String.format(
                    "Campaign %s failed: %s. The payment was refunded to the advertiser.",
                    campaign, event.getFailureReason())));
            }
            case CANCELLED, EXPIRED -> {
                boolean refunded = event.getFromStatus().holdsFunds();
                messages.add(new Message(event.getAdvertiserId(), String.format(
                    "Campaign %s ended: %s.%s", campaign, event.getFailureReason(),
                    refunded ? " " + event.getBudget() + " was returned to your balance." : "")));
                if (event.getFromStatus() == CampaignStatus.ACCEPTED) {
                    messages.add(new Message(event.getChannelOwnerId(), String.format(
                        "Campaign %s on %s ended before posting: %s.", campaign, channel, event.getFailureReason())));
                }
            }
            default -> {
            }
        }
        return messages;
    }

    private static String shortId(UUID id) {
        return "#" + id.toString().substring(0, 8);
    }

    record Message(UUID recipient, String content) {
    }
}
