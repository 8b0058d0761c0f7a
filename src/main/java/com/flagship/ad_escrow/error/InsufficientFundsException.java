package com.flagship.ad_escrow.error;

import java.util.UUID;

public class InsufficientFundsException extends EscrowEngineException {

    private final UUID actorId;
    private final long required;
    private final long available;

    public InsufficientFundsException(UUID actorId, long required, long available) {
        super(String.format("Insufficient funds for %s: required=%d, available=%d", actorId, required, available));
        this.actorId = actorId;
        this.required = required;
        this.available = available;
    }

    public UUID getActorId() {
        return actorId;
    }

    public long getRequired() {
        return required;
    }

    public long getAvailable() {
        return available;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INSUFFICIENT_FUNDS;
    }
}
