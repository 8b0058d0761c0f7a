package com.flagship.ad_escrow.error;

public class InvalidTransitionException extends EscrowEngineException {

    public InvalidTransitionException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INVALID_TRANSITION;
    }
}
