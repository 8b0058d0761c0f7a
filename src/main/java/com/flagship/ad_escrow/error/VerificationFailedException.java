package com.flagship.ad_escrow.error;

public class VerificationFailedException extends EscrowEngineException {

    public VerificationFailedException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VERIFICATION_FAILED;
    }
}
