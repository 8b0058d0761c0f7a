package com.flagship.ad_escrow.channel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Periodically re-probes VERIFIED and PENDING channels, least recently verified first.
 */
@Component
@ConditionalOnProperty(name = "verification.recheck.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ChannelReverificationScheduler {

    private final ChannelService channelService;
    private final ChannelVerifier channelVerifier;

    @Scheduled(fixedDelayString = "${verification.recheck-interval:PT5M}",
               initialDelayString = "${verification.recheck-initial-delay:PT1M}")
    public void reverifyChannels() {
        List<UUID> channelIds = channelService.findIdsByStatus(
            EnumSet.of(ChannelStatus.VERIFIED, ChannelStatus.PENDING));
        if (channelIds.isEmpty()) {
            return;
        }

        log.debug("Re-verifying {} channels", channelIds.size());
        int revoked = 0;
        for (UUID channelId : channelIds) {
            try {
                VerificationResult result = channelVerifier.verify(channelId);
                if (result.getStatus() == ChannelStatus.REVOKED && result.isStatusChanged()) {
                    revoked++;
                }
            } catch (Exception e) {
                log.error("Re-verification failed: channelId={}, error={}", channelId, e.getMessage(), e);
            }
        }
        log.info("Channel re-verification sweep finished: checked={}, revoked={}", channelIds.size(), revoked);
    }
}
