package com.flagship.ad_escrow.simulator;

import com.flagship.ad_escrow.channel.ChannelProbe;
import com.flagship.ad_escrow.channel.ChannelProbeException;
import com.flagship.ad_escrow.channel.ChannelProbeResult;
import com.flagship.ad_escrow.messaging.MessagingTransport;
import com.flagship.ad_escrow.posting.PostingTransport;
import com.flagship.ad_escrow.posting.PostingTransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;


import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory stand-in for the chat platform.
 *
 * Channels are unknown until {@link #registerChannel} is called, so probing them
 * fails as unavailable. Failures can be scripted per channel and consumed in order.
 */
@Component
@ConditionalOnProperty(name = "gateway.mode", havingValue = "simulated", matchIfMissing = true)
@Slf4j
public class SimulatedTelegramGateway implements PostingTransport, ChannelProbe, MessagingTransport {

    private final Map<String, ChannelProbeResult> channels = new ConcurrentHashMap<>();
    private final Map<String, Deque<PostingTransportException>> publishFailures = new ConcurrentHashMap<>();
    private final Map<String, String> placements = new ConcurrentHashMap<>();
    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
    private final Map<UUID, List<String>> inbox = new ConcurrentHashMap<>();
    private final AtomicLong messageIds = new AtomicLong();
    private final int defaultSubscribers;

    public SimulatedTelegramGateway(@Value("${gateway.simulated.default-subscribers:1000}") int defaultSubscribers) {
        this.defaultSubscribers = defaultSubscribers;
    }

    // scripting

    public void registerChannel(String channelExternalId) {
        channels.put(channelExternalId, ChannelProbeResult.admin(defaultSubscribers));
    }

    public void setProbeResult(String channelExternalId, ChannelProbeResult result) {
        channels.put(channelExternalId, result);
    }

    public void setReachable(String channelExternalId, boolean reachable) {
        if (reachable) {
            unreachable.remove(channelExternalId);
        } else {
            unreachable.add(channelExternalId);
        }
    }

    public void failNextPublishes(String channelExternalId, int times, boolean transientFailure) {
        Deque<PostingTransportException> failures =
                publishFailures.computeIfAbsent(channelExternalId, id -> new ConcurrentLinkedDeque<>());
        for (int i = 0; i < times; i++) {
            failures.add(new PostingTransportException("Simulated publish failure", transientFailure));
        }
    }

    public void removePlacement(String placementRef) {
        placements.remove(placementRef);
    }

    public List<String> messagesFor(UUID userId) {
        return List.copyOf(inbox.getOrDefault(userId, List.of()));
    }

    public void reset() {
        channels.clear();
        publishFailures.clear();
        placements.clear();
        unreachable.clear();
        inbox.clear();
    }

    // ChannelProbe

    @Override
    public ChannelProbeResult probe(String channelExternalId) {
        ChannelProbeResult result = channels.get(channelExternalId);
        if (result == null || unreachable.contains(channelExternalId)) {
            throw new ChannelProbeException("Channel " + channelExternalId + " is not reachable");
        }
        return result;
    }

    // PostingTransport

    @Override
    public String publish(String channelExternalId, String content) {
        if (unreachable.contains(channelExternalId)) {
            throw PostingTransportException.transientFailure("Channel " + channelExternalId + " is not reachable");
        }
        Deque<PostingTransportException> failures = publishFailures.get(channelExternalId);
        PostingTransportException scripted = failures == null ? null : failures.poll();
        if (scripted != null) {
            throw scripted;
        }
        ChannelProbeResult channel = channels.get(channelExternalId);
        if (channel == null || !channel.isBotIsAdmin()) {
            throw PostingTransportException.permanentFailure("Bot cannot post to " + channelExternalId);
        }
        String placementRef = channelExternalId + "/" + messageIds.incrementAndGet();
        placements.put(placementRef, content);
        log.debug("Simulated post: placementRef={}", placementRef);
        return placementRef;
    }

    @Override
    public boolean exists(String placementRef) {
        int separator = placementRef.lastIndexOf('/');
        if (separator < 0) {
            return false;
        }
        String channelExternalId = placementRef.substring(0, separator);
        if (unreachable.contains(channelExternalId)) {
            throw PostingTransportException.transientFailure("Channel " + channelExternalId + " is not reachable");
        }
        return placements.containsKey(placementRef);
    }

    // MessagingTransport

    @Override
    public boolean send(UUID userId, String content) {
        inbox.computeIfAbsent(userId, id -> new CopyOnWriteArrayList<>()).add(content);
        return true;
    }
}
