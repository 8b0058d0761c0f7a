package com.flagship.ad_escrow.maintenance;

import com.flagship.ad_escrow.campaign.CampaignPersistenceService;
import com.flagship.ad_escrow.campaign.CampaignStateMachine;
import com.flagship.ad_escrow.campaign.CampaignStatus;
import com.flagship.ad_escrow.error.EscrowEngineException;
import com.flagship.ad_escrow.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Time-driven campaign transitions.
 *
 * Each campaign is handled in its own transaction. A failure on one is logged and
 * the sweep moves on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignMaintenanceService {

    private static final Set<CampaignStatus> EXPIRABLE =
            EnumSet.of(CampaignStatus.FUNDED, CampaignStatus.OFFERED, CampaignStatus.ACCEPTED);

    private final CampaignPersistenceService campaigns;
    private final CampaignStateMachine stateMachine;
    private final Clock clock;

    /**
     * Expires and refunds every FUNDED, OFFERED or ACCEPTED campaign past its deadline,
     * whether or not a posting retry is pending.
     *
     * @return number of campaigns expired
     */
    public int expireDueCampaigns() {
        List<UUID> due = campaigns.findIdsDueForExpiry(EXPIRABLE, clock.instant());
        int expired = forEach(due, "expire", stateMachine::expire);
        if (!due.isEmpty()) {
            log.info("Expiry sweep: expired={}, due={}", expired, due.size());
        }
        return expired;
    }

    /**
     * Puts FUNDED campaigns whose offer step never happened on offer.
     *
     * @return number of campaigns offered
     */
    public int offerStalledCampaigns() {
        List<UUID> stalled = campaigns.findIdsByStatus(CampaignStatus.FUNDED);
        int offered = forEach(stalled, "offer", stateMachine::offer);
        if (!stalled.isEmpty()) {
            log.info("Stalled sweep: offered={}, funded={}", offered, stalled.size());
        }
        return offered;
    }

    private int forEach(List<UUID> campaignIds, String action, Consumer<UUID> transition) {
        int done = 0;
        for (UUID campaignId : campaignIds) {
            try (CorrelationContext.Scope ignored = CorrelationContext.openCampaignScope(campaignId)) {
                transition.accept(campaignId);
                done++;
            } catch (EscrowEngineException e) {
                log.info("Skipped {} for campaign {}: {}", action, campaignId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Failed to {} campaign {}", action, campaignId, e);
            }
        }
        return done;
    }
}
