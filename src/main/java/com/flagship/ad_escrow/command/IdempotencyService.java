package com.flagship.ad_escrow.command;

import com.flagship.ad_escrow.campaign.Campaign;
import com.flagship.ad_escrow.campaign.CampaignPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Campaign-creation idempotency keys.
 *
 * Redis is the fast path and may be unavailable; the campaigns table, which stores
 * the key with a unique constraint, is the source of truth. Keys are scoped per
 * advertiser so two advertisers never collide on the same client-chosen key.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:campaign:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final CampaignPersistenceService campaigns;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(CampaignPersistenceService campaigns,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.campaigns = campaigns;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Key as stored on the campaign row.
     */
    public static String scopedKey(UUID advertiserId, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        return advertiserId + ":" + idempotencyKey;
    }

    /**
     * @return id of the campaign already created with this key, if any
     */
    public Optional<UUID> findCampaignId(UUID advertiserId, String idempotencyKey) {
        String scoped = scopedKey(advertiserId, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String campaignId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + scoped);
                if (campaignId != null) {
                    log.debug("Idempotency key found in Redis: {}", scoped);
                    return Optional.of(UUID.fromString(campaignId));
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        scoped, e.getMessage());
            }
        }

        Optional<UUID> stored = campaigns.findByIdempotencyKey(scoped).map(Campaign::getId);
        stored.ifPresent(campaignId -> {
            log.debug("Idempotency key found in database: {}", scoped);
            cache(scoped, campaignId);
        });
        return stored;
    }

    /**
     * Caches the mapping; the database row written with the campaign already holds it.
     */
    public void remember(UUID advertiserId, String idempotencyKey, UUID campaignId) {
        cache(scopedKey(advertiserId, idempotencyKey), campaignId);
    }

    private void cache(String scoped, UUID campaignId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + scoped, campaignId.toString(), REDIS_TTL);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", scoped, e.getMessage());
        }
    }
}
