package com.flagship.ad_escrow.error;

/**
 * Base type for all typed engine failures.
 * The message is for logs; callers facing users should use {@link ErrorKind#getUserMessage()}.
 */
public abstract class EscrowEngineException extends RuntimeException {

    protected EscrowEngineException(String message) {
        super(message);
    }

    protected EscrowEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();
}
