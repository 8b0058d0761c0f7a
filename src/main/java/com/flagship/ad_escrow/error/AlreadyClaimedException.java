package com.flagship.ad_escrow.error;

public class AlreadyClaimedException extends EscrowEngineException {

    public AlreadyClaimedException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.ALREADY_CLAIMED;
    }
}
