package com.flagship.ad_escrow.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Oldest sendable events, locked for the caller. Rows held by another publisher are
     * skipped; dead-lettered rows are never returned.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL AND attempts < :maxAttempts
        ORDER BY sequence_number
        LIMIT :batchSize
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> lockSendable(@Param("batchSize") int batchSize,
                                         @Param("maxAttempts") int maxAttempts);

    List<OutboxEventEntity> findByCampaignIdOrderBySequenceNumberAsc(UUID campaignId);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL AND e.attempts >= :maxAttempts")
    long countDeadLettered(@Param("maxAttempts") int maxAttempts);

    @Query("SELECT MIN(e.createdAt) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
