package com.flagship.ad_escrow.campaign;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CampaignRepository extends JpaRepository<CampaignEntity, UUID> {

    /**
     * Loads the campaign holding its row lock until the transaction ends.
     * Every lifecycle transition goes through this query, which serializes them per campaign.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CampaignEntity c WHERE c.id = :id")
    Optional<CampaignEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<CampaignEntity> findByIdempotencyKey(String idempotencyKey);

    List<CampaignEntity> findByAdvertiserIdOrderByCreatedAtDesc(UUID advertiserId);

    /**
     * Open offers for a channel owner: unexpired, not the owner's own, owner not excluded.
     */
    @Query("""
        SELECT c FROM CampaignEntity c
        WHERE c.status = com.flagship.ad_escrow.campaign.CampaignStatus.OFFERED
        AND c.expiresAt > :now
        AND c.advertiserId <> :ownerId
        AND NOT EXISTS (
            SELECT e FROM CampaignExclusionEntity e
            WHERE e.campaignId = c.id AND e.ownerId = :ownerId
        )
        ORDER BY c.createdAt ASC
        """)
    List<CampaignEntity> findOpenOffersFor(@Param("ownerId") UUID ownerId, @Param("now") Instant now);

    @Query("""
        SELECT c.id FROM CampaignEntity c
        WHERE c.status IN :statuses AND c.expiresAt <= :now
        ORDER BY c.expiresAt ASC
        """)
    List<UUID> findIdsDueForExpiry(@Param("statuses") Collection<CampaignStatus> statuses,
                                   @Param("now") Instant now);

    @Query("SELECT c.id FROM CampaignEntity c WHERE c.status = :status ORDER BY c.updatedAt ASC")
    List<UUID> findIdsByStatus(@Param("status") CampaignStatus status);

    @Query("SELECT c.id FROM CampaignEntity c WHERE c.channelId = :channelId AND c.status = :status")
    List<UUID> findIdsByChannelIdAndStatus(@Param("channelId") UUID channelId,
                                           @Param("status") CampaignStatus status);

    long countByStatus(CampaignStatus status);
}
