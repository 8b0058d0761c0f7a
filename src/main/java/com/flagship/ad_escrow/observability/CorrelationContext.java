package com.flagship.ad_escrow.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the engine.
 *
 * HTTP requests get their id from {@link CorrelationIdFilter}; background tasks
 * (posting attempts, sweeps) open their own scope with {@link #openCampaignScope(UUID)}.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CAMPAIGN_ID_MDC_KEY = "campaignId";
    public static final String USER_ID_MDC_KEY = "userId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short ids keep log lines readable.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts the campaign id (and a fresh correlation id when none is set) into the MDC.
     * Close the returned scope to restore the previous state.
     */
    public static Scope openCampaignScope(UUID campaignId) {
        boolean ownsCorrelation = MDC.get(CORRELATION_ID_MDC_KEY) == null;
        if (ownsCorrelation) {
            MDC.put(CORRELATION_ID_MDC_KEY, generateCorrelationId());
        }
        String previousCampaign = MDC.get(CAMPAIGN_ID_MDC_KEY);
        MDC.put(CAMPAIGN_ID_MDC_KEY, String.valueOf(campaignId));
        return () -> {
            if (previousCampaign != null) {
                MDC.put(CAMPAIGN_ID_MDC_KEY, previousCampaign);
            } else {
                MDC.remove(CAMPAIGN_ID_MDC_KEY);
            }
            if (ownsCorrelation) {
                MDC.remove(CORRELATION_ID_MDC_KEY);
            }
        };
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
