package com.flagship.ad_escrow.error;

public class CampaignExpiredException extends EscrowEngineException {

    public CampaignExpiredException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.EXPIRED;
    }
}
