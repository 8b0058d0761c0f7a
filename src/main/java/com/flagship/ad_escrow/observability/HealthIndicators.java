package com.flagship.ad_escrow.observability;

import com.flagship.ad_escrow.escrow.EscrowHoldRepository;
import com.flagship.ad_escrow.escrow.EscrowHoldStatus;
import com.flagship.ad_escrow.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

/**
 * Actuator health checks for the engine.
 */
public class HealthIndicators {

    private static final Status DEGRADED = new Status("DEGRADED");

    /**
     * Lifecycle notifications lag behind campaign state while events wait in the outbox.
     * Dead-lettered events need an operator and turn the check down.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private final OutboxEventRepository outboxRepository;
        private final long degradedBacklog;
        private final int maxAttempts;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.health.degraded-backlog:1000}") long degradedBacklog,
                                     @Value("${outbox.publisher.max-retries:5}") int maxAttempts) {
            this.outboxRepository = outboxRepository;
            this.degradedBacklog = degradedBacklog;
            this.maxAttempts = maxAttempts;
        }

        @Override
        public Health health() {
            try {
                long pending = outboxRepository.countUnpublished();
                long deadLettered = outboxRepository.countDeadLettered(maxAttempts);
                Status status = deadLettered > 0 ? Status.DOWN
                        : pending >= degradedBacklog ? DEGRADED
                        : Status.UP;
                return Health.status(status)
                        .withDetail("pending", pending)
                        .withDetail("deadLettered", deadLettered)
                        .withDetail("degradedBacklog", degradedBacklog)
                        .build();
            } catch (DataAccessException e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Open escrow: how many holds are waiting to be finalized and how much they hold.
     */
    @Component("escrowHealth")
    public static class EscrowHealthIndicator implements HealthIndicator {

        private final EscrowHoldRepository holdRepository;

        public EscrowHealthIndicator(EscrowHoldRepository holdRepository) {
            this.holdRepository = holdRepository;
        }

        @Override
        public Health health() {
            try {
                return Health.up()
                        .withDetail("openHolds", holdRepository.countByStatus(EscrowHoldStatus.HELD))
                        .withDetail("heldAmount", holdRepository.sumAmountByStatus(EscrowHoldStatus.HELD))
                        .build();
            } catch (DataAccessException e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Redis serves idempotency lookups only. Losing it slows campaign creation but
     * never blocks it, so the check reports DEGRADED rather than DOWN.
     */
    @Component("idempotencyCacheHealth")
    public static class IdempotencyCacheHealthIndicator implements HealthIndicator {

        private final RedisConnectionFactory connectionFactory;

        public IdempotencyCacheHealthIndicator(RedisConnectionFactory connectionFactory) {
            this.connectionFactory = connectionFactory;
        }

        @Override
        public Health health() {
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String pong = connection.ping();
                return Health.up().withDetail("ping", pong).build();
            } catch (RuntimeException e) {
                return Health.status(DEGRADED)
                        .withDetail("fallback", "campaigns.idempotency_key")
                        .withDetail("error", String.valueOf(e.getMessage()))
                        .build();
            }
        }
    }
}
