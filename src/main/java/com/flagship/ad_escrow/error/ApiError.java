package com.flagship.ad_escrow.error;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by the HTTP layer.
 * {@code error} holds the {@link ErrorKind} name for engine failures.
 */
@Value
@Builder
public class ApiError {
    String error;
    String message;
    Map<String, String> details;
    String correlationId;
    Instant timestamp;
}
