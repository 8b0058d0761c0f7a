package com.flagship.ad_escrow.error;

import java.util.UUID;

/**
 * Raised when placement could not be completed after the retry ceiling,
 * or failed permanently. The campaign has already been re-offered when this surfaces.
 */
public class PlacementFailedException extends EscrowEngineException {

    private final UUID campaignId;
    private final int attempts;

    public PlacementFailedException(UUID campaignId, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.campaignId = campaignId;
        this.attempts = attempts;
    }

    public UUID getCampaignId() {
        return campaignId;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.PLACEMENT_FAILED;
    }
}
