package com.flagship.ad_escrow.campaign;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CampaignExclusionRepository extends JpaRepository<CampaignExclusionEntity, UUID> {

    @Query("SELECT e.ownerId FROM CampaignExclusionEntity e WHERE e.campaignId = :campaignId")
    List<UUID> findOwnerIdsByCampaignId(@Param("campaignId") UUID campaignId);

    List<CampaignExclusionEntity> findByCampaignIdIn(List<UUID> campaignIds);
}
