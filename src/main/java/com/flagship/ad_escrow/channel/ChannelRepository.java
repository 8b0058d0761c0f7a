package com.flagship.ad_escrow.channel;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ChannelRepository extends JpaRepository<ChannelEntity, UUID> {

    Optional<ChannelEntity> findByExternalId(String externalId);

    List<ChannelEntity> findByOwnerIdOrderByCreatedAtAsc(UUID ownerId);

    boolean existsByOwnerIdAndStatus(UUID ownerId, ChannelStatus status);

    /**
     * Loads the channel holding a row lock until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ChannelEntity c WHERE c.id = :id")
    Optional<ChannelEntity> findByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("SELECT c FROM ChannelEntity c WHERE c.id = :id")
    Optional<ChannelEntity> findByIdForShare(@Param("id") UUID id);

    @Query("SELECT c.id FROM ChannelEntity c WHERE c.status IN :statuses ORDER BY c.lastVerifiedAt ASC NULLS FIRST")
    List<UUID> findIdsByStatusIn(@Param("statuses") Collection<ChannelStatus> statuses);
}
