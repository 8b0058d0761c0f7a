package com.flagship.ad_escrow.error;

import org.springframework.http.HttpStatus;

/**
 * Failure kinds surfaced by the engine.
 *
 * Every guard failure maps to exactly one kind. The user message is a
 * category the front end can show as-is; internal detail stays in logs.
 */
public enum ErrorKind {

    INSUFFICIENT_FUNDS(HttpStatus.UNPROCESSABLE_ENTITY,
            "Your balance is too low for this action. Top up and try again."),

    INVALID_TRANSITION(HttpStatus.CONFLICT,
            "This action is not available for the campaign in its current state."),

    ALREADY_CLAIMED(HttpStatus.CONFLICT,
            "Another channel has already accepted this offer."),

    VERIFICATION_FAILED(HttpStatus.FORBIDDEN,
            "The channel is not verified. Make the bot an administrator and request verification."),

    PLACEMENT_FAILED(HttpStatus.BAD_GATEWAY,
            "The ad could not be posted to the channel. The campaign has been offered again."),

    EXPIRED(HttpStatus.GONE,
            "This campaign has expired."),

    NOT_FOUND(HttpStatus.NOT_FOUND,
            "The requested item does not exist.");

    private final HttpStatus httpStatus;
    private final String userMessage;

    ErrorKind(HttpStatus httpStatus, String userMessage) {
        this.httpStatus = httpStatus;
        this.userMessage = userMessage;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
