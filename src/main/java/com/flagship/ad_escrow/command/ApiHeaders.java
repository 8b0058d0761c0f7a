package com.flagship.ad_escrow.command;

final class ApiHeaders {

    static final String USER_ID = "X-User-Id";
    static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private ApiHeaders() {
    }
}
