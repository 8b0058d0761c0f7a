package com.flagship.ad_escrow.campaign;

import com.flagship.ad_escrow.channel.ChannelStatusChangedEvent;
import com.flagship.ad_escrow.error.EscrowEngineException;
import com.flagship.ad_escrow.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Unbinds accepted campaigns from a channel that lost its verification.
 * Also used by posting when it finds the bound channel no longer VERIFIED.
 *
 * A campaign whose deadline is further away than the recovery window goes back on offer
 * without the revoked owner; one closer to its deadline is cancelled and refunded.
 */
@Component
@Slf4j
public class ChannelRevocationHandler {

    static final String REVOKED_REASON = "Channel verification revoked";

    private final CampaignStateMachine stateMachine;
    private final CampaignPersistenceService persistence;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration recoveryWindow;

    public ChannelRevocationHandler(CampaignStateMachine stateMachine,
                                    CampaignPersistenceService persistence,
                                    TaskScheduler taskScheduler,
                                    Clock clock,
                                    @Value("${verification.recovery-window:PT1H}") Duration recoveryWindow) {
        this.stateMachine = stateMachine;
        this.persistence = persistence;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.recoveryWindow = recoveryWindow;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onChannelStatusChanged(ChannelStatusChangedEvent event) {
        if (!event.isRevocation()) {
            return;
        }
        // the committed transaction is still bound to this thread
        taskScheduler.schedule(() -> handleRevocation(event.getChannelId()), clock.instant());
    }

    /**
     * Returns the number of campaigns moved off the channel.
     */
    public int handleRevocation(UUID channelId) {
        List<UUID> accepted = persistence.findIdsByChannelAndStatus(channelId, CampaignStatus.ACCEPTED);
        int handled = 0;
        for (UUID campaignId : accepted) {
            try (CorrelationContext.Scope ignored = CorrelationContext.openCampaignScope(campaignId)) {
                if (unbind(campaignId, REVOKED_REASON)) {
                    handled++;
                }
            }
        }
        log.info("Channel revocation handled: channelId={}, campaigns={}/{}", channelId, handled, accepted.size());
        return handled;
    }

    /**
     * Takes one ACCEPTED campaign off its channel, re-offering or cancelling it depending on
     * how close its deadline is.
     *
     * @return false when the campaign was no longer ACCEPTED or the transition failed
     */
    public boolean unbind(UUID campaignId, String reason) {
        try {
            stateMachine.unbindChannel(campaignId, reason, recoveryWindow);
            return true;
        } catch (EscrowEngineException e) {
            // posted, expired or re-offered in the meantime
            log.info("Campaign left on its channel: {}", e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to unbind campaign {} from its channel", campaignId, e);
            return false;
        }
    }
}
