package com.flagship.ad_escrow.error;

public class NotFoundException extends EscrowEngineException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }
}
