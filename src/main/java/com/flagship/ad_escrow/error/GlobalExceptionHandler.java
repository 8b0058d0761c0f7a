package com.flagship.ad_escrow.error;

import com.flagship.ad_escrow.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps engine failures and request errors to {@link ApiError} responses.
 *
 * Engine failures carry their {@link ErrorKind}; the response holds the kind name
 * and its user-facing category message, never the internal exception message.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(EscrowEngineException.class)
    public ResponseEntity<ApiError> handleEngineException(EscrowEngineException e) {
        ErrorKind kind = e.getKind();
        log.warn("Command rejected: kind={}, reason={}", kind, e.getMessage());

        return ResponseEntity.status(kind.getHttpStatus()).body(build(kind.name(), kind.getUserMessage(), null));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(build(
                "Missing Required Header",
                "Required header '" + e.getHeaderName() + "' is missing",
                null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(build("Validation Failed", "Request validation failed", errors));
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleUnreadableRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(build("Invalid Request", "Request could not be read", null));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(build("Invalid Request", e.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(build("Internal Server Error", "An unexpected error occurred", null));
    }

    private ApiError build(String error, String message, Map<String, String> details) {
        return ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .correlationId(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY))
            .timestamp(Instant.now())
            .build();
    }
}
