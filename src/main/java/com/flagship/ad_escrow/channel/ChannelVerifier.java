package com.flagship.ad_escrow.channel;

import com.flagship.ad_escrow.gateway.OutboundCallExecutor;
import com.flagship.ad_escrow.observability.EngineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Confirms that the bot administers a channel and records the resulting status.
 *
 * The probe runs outside any database transaction, bounded by the probe timeout;
 * its outcome is then applied under the channel row lock, deciding against the
 * freshly locked state.
 *
 * Decision table:
 * <pre>
 * admin, subscribers and trust at or above thresholds -> VERIFIED
 * admin, below a threshold                            -> PENDING
 * not admin, currently VERIFIED                       -> REVOKED
 * not admin, otherwise                                -> PENDING
 * probe unavailable, currently VERIFIED               -> unchanged
 * probe unavailable, otherwise                        -> PENDING
 * </pre>
 */
@Service
@Slf4j
public class ChannelVerifier {

    private final ChannelService channelService;
    private final ChannelProbe channelProbe;
    private final OutboundCallExecutor outboundCalls;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final int minSubscribers;
    private final int minTrustScore;
    private final Duration probeTimeout;

    public ChannelVerifier(ChannelService channelService,
                           ChannelProbe channelProbe,
                           OutboundCallExecutor outboundCalls,
                           EngineMetrics metrics,
                           Clock clock,
                           @Value("${verification.min-subscribers:100}") int minSubscribers,
                           @Value("${verification.min-trust-score:30}") int minTrustScore,
                           @Value("${verification.probe-timeout:PT5S}") Duration probeTimeout) {
        this.channelService = channelService;
        this.channelProbe = channelProbe;
        this.outboundCalls = outboundCalls;
        this.metrics = metrics;
        this.clock = clock;
        this.minSubscribers = minSubscribers;
        this.minTrustScore = minTrustScore;
        this.probeTimeout = probeTimeout;
    }

    public VerificationResult verify(UUID channelId) {
        Channel channel = channelService.require(channelId);

        ChannelProbeResult probeResult = null;
        String unavailableReason = null;
        try {
            probeResult = outboundCalls.call("probe:" + channel.getExternalId(),
                    () -> channelProbe.probe(channel.getExternalId()), probeTimeout);
        } catch (ChannelProbeException | TimeoutException e) {
            unavailableReason = e.getMessage();
            log.warn("Channel probe unavailable: channelId={}, reason={}", channelId, unavailableReason);
        }

        ChannelProbeResult outcome = probeResult;
        ChannelService.ChannelUpdate update = channelService.update(channelId, current ->
            current.applyVerification(decide(current, outcome).status(),
                    outcome != null ? outcome.getSubscriberCount() : null, clock.instant()));

        Channel after = update.getAfter();
        String reason = outcome == null
            ? "Probe unavailable: " + unavailableReason
            : decide(update.getBefore(), outcome).reason();
        VerificationResult result = new VerificationResult(
            channelId,
            update.getBefore().getStatus(),
            after.getStatus(),
            outcome != null,
            after.getSubscriberCount(),
            after.getTrustScore(),
            after.isVerified() ? null : reason
        );

        metrics.recordVerification(after.getStatus().name());
        log.info("Channel verification finished: channelId={}, status={} -> {}, subscribers={}, trust={}, reason={}",
                channelId, result.getPreviousStatus(), result.getStatus(),
                result.getSubscriberCount(), result.getTrustScore(), result.getReason());
        return result;
    }

    /**
     * Lowers the channel's trust score by {@code points}, floored at zero.
     */
    public Channel penalize(UUID channelId, int points) {
        Channel penalized = channelService.update(channelId, current -> current.penalize(points, clock.instant()))
            .getAfter();
        log.info("Channel trust penalized: channelId={}, points={}, trustScore={}",
                channelId, points, penalized.getTrustScore());
        return penalized;
    }

    /**
     * Pure decision over the current channel state and the probe outcome (null when unavailable).
     */
    Decision decide(Channel current, ChannelProbeResult probe) {
        if (probe == null) {
            return current.isVerified()
                ? new Decision(ChannelStatus.VERIFIED, null)
                : new Decision(ChannelStatus.PENDING, "Probe unavailable");
        }
        if (!probe.isBotIsAdmin()) {
            return current.isVerified()
                ? new Decision(ChannelStatus.REVOKED, "Bot lost administrator rights")
                : new Decision(ChannelStatus.PENDING, "Bot is not an administrator of the channel");
        }
        if (probe.getSubscriberCount() < minSubscribers) {
            return new Decision(ChannelStatus.PENDING,
                "Subscriber count " + probe.getSubscriberCount() + " is below " + minSubscribers);
        }
        if (current.getTrustScore() < minTrustScore) {
            return new Decision(ChannelStatus.PENDING,
                "Trust score " + current.getTrustScore() + " is below " + minTrustScore);
        }
        return new Decision(ChannelStatus.VERIFIED, null);
    }

    record Decision(ChannelStatus status, String reason) {
    }
}
