package com.flagship.ad_escrow.campaign;

import com.flagship.ad_escrow.error.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Bridges {@link Campaign} and its two tables.
 *
 * Writes use {@link Propagation#MANDATORY}: campaigns are only ever written by a
 * state machine transition, inside its transaction and under its row lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignPersistenceService {

    private final CampaignRepository campaignRepository;
    private final CampaignExclusionRepository exclusionRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public Campaign insert(Campaign campaign, String idempotencyKey) {
        campaignRepository.save(CampaignEntity.fromDomain(campaign, idempotencyKey));
        saveNewExclusions(campaign, Set.of(), campaign.getCreatedAt());
        log.debug("Inserted campaign {} with idempotency key {}", campaign.getId(), idempotencyKey);
        return campaign;
    }

    /**
     * Loads and row-locks the campaign for a transition.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Campaign lock(UUID campaignId) {
        CampaignEntity entity = campaignRepository.findByIdForUpdate(campaignId)
            .orElseThrow(() -> new NotFoundException("Campaign not found: " + campaignId));
        return entity.toDomain(loadExclusions(campaignId));
    }

    /**
     * Writes the lifecycle fields and any newly added exclusions. The row must be locked by the caller.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Campaign update(Campaign before, Campaign after) {
        CampaignEntity entity = campaignRepository.findById(after.getId())
            .orElseThrow(() -> new NotFoundException("Campaign not found: " + after.getId()));
        entity.updateFromDomain(after);
        campaignRepository.save(entity);
        saveNewExclusions(after, before.getExcludedOwnerIds(), after.getUpdatedAt());
        log.debug("Updated campaign {}: {} -> {}", after.getId(), before.getStatus(), after.getStatus());
        return after;
    }

    @Transactional(readOnly = true)
    public Optional<Campaign> findById(UUID campaignId) {
        return campaignRepository.findById(campaignId)
            .map(entity -> entity.toDomain(loadExclusions(campaignId)));
    }

    @Transactional(readOnly = true)
    public Campaign require(UUID campaignId) {
        return findById(campaignId)
            .orElseThrow(() -> new NotFoundException("Campaign not found: " + campaignId));
    }

    @Transactional(readOnly = true)
    public Optional<Campaign> findByIdempotencyKey(String idempotencyKey) {
        return campaignRepository.findByIdempotencyKey(idempotencyKey)
            .map(entity -> entity.toDomain(loadExclusions(entity.getId())));
    }

    @Transactional(readOnly = true)
    public List<Campaign> listByAdvertiser(UUID advertiserId) {
        return toDomain(campaignRepository.findByAdvertiserIdOrderByCreatedAtDesc(advertiserId));
    }

    @Transactional(readOnly = true)
    public List<Campaign> findOpenOffersFor(UUID ownerId, Instant now) {
        return toDomain(campaignRepository.findOpenOffersFor(ownerId, now));
    }

    @Transactional(readOnly = true)
    public List<UUID> findIdsDueForExpiry(Collection<CampaignStatus> statuses, Instant now) {
        return campaignRepository.findIdsDueForExpiry(statuses, now);
    }

    @Transactional(readOnly = true)
    public List<UUID> findIdsByStatus(CampaignStatus status) {
        return campaignRepository.findIdsByStatus(status);
    }

    @Transactional(readOnly = true)
    public List<UUID> findIdsByChannelAndStatus(UUID channelId, CampaignStatus status) {
        return campaignRepository.findIdsByChannelIdAndStatus(channelId, status);
    }

    private Set<UUID> loadExclusions(UUID campaignId) {
        return Set.copyOf(exclusionRepository.findOwnerIdsByCampaignId(campaignId));
    }

    private List<Campaign> toDomain(List<CampaignEntity> entities) {
        if (entities.isEmpty()) {
            return List.of();
        }
        Map<UUID, Set<UUID>> exclusions = exclusionRepository
            .findByCampaignIdIn(entities.stream().map(CampaignEntity::getId).toList())
            .stream()
            .collect(Collectors.groupingBy(CampaignExclusionEntity::getCampaignId,
                Collectors.mapping(CampaignExclusionEntity::getOwnerId, Collectors.toSet())));
        return entities.stream()
            .map(entity -> entity.toDomain(exclusions.getOrDefault(entity.getId(), Set.of())))
            .toList();
    }

    private void saveNewExclusions(Campaign campaign, Set<UUID> alreadyStored, Instant now) {
        for (UUID ownerId : campaign.getExcludedOwnerIds()) {
            if (!alreadyStored.contains(ownerId)) {
                exclusionRepository.save(
                    CampaignExclusionEntity.of(campaign.getId(), ownerId, campaign.getFailureReason(), now));
            }
        }
    }
}
