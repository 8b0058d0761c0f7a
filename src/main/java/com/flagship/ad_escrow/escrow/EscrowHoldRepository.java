package com.flagship.ad_escrow.escrow;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface EscrowHoldRepository extends JpaRepository<EscrowHoldEntity, UUID> {

    Optional<EscrowHoldEntity> findByCampaignId(UUID campaignId);

    boolean existsByCampaignId(UUID campaignId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM EscrowHoldEntity h WHERE h.id = :id")
    Optional<EscrowHoldEntity> findByIdForUpdate(@Param("id") UUID id);

    long countByStatus(EscrowHoldStatus status);

    @Query("SELECT COALESCE(SUM(h.amount), 0) FROM EscrowHoldEntity h WHERE h.status = :status")
    long sumAmountByStatus(@Param("status") EscrowHoldStatus status);
}
