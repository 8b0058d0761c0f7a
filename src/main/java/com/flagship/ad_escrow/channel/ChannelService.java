package com.flagship.ad_escrow.channel;

import com.flagship.ad_escrow.error.NotFoundException;
import com.flagship.ad_escrow.error.VerificationFailedException;
import com.flagship.ad_escrow.user.User;
import com.flagship.ad_escrow.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Registration, lookup and locked updates of channels.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChannelService {

    private final ChannelRepository channelRepository;
    private final UserService userService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Registers a channel for its owner in UNVERIFIED state.
     * Registering the same channel again by the same owner returns the existing record.
     *
     * @throws VerificationFailedException if the user cannot own channels or another owner holds the channel
     */
    @Transactional
    public Channel register(UUID ownerId, String externalId, String title) {
        User owner = userService.requireActive(ownerId);
        if (!owner.canOwnChannels()) {
            throw new VerificationFailedException("User " + ownerId + " is not registered as a channel owner");
        }

        Optional<ChannelEntity> existing = channelRepository.findByExternalId(externalId);
        if (existing.isPresent()) {
            Channel channel = existing.get().toDomain();
            if (!channel.isOwnedBy(ownerId)) {
                throw new VerificationFailedException(
                    "Channel " + externalId + " is already registered by another owner");
            }
            log.debug("Channel already registered: channelId={}, externalId={}", channel.getId(), externalId);
            return channel;
        }

        Channel channel = Channel.register(UUID.randomUUID(), ownerId, externalId, title, clock.instant());
        channelRepository.save(ChannelEntity.fromDomain(channel));
        log.info("Registered channel: channelId={}, ownerId={}, externalId={}", channel.getId(), ownerId, externalId);
        return channel;
    }

    @Transactional(readOnly = true)
    public Optional<Channel> findById(UUID channelId) {
        return channelRepository.findById(channelId).map(ChannelEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Channel require(UUID channelId) {
        return findById(channelId)
            .orElseThrow(() -> new NotFoundException("Channel not found: " + channelId));
    }

    @Transactional(readOnly = true)
    public List<Channel> listByOwner(UUID ownerId) {
        return channelRepository.findByOwnerIdOrderByCreatedAtAsc(ownerId).stream()
            .map(ChannelEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public boolean hasVerifiedChannel(UUID ownerId) {
        return channelRepository.existsByOwnerIdAndStatus(ownerId, ChannelStatus.VERIFIED);
    }

    /**
     * Guard for claiming: the channel must exist, belong to the owner and be VERIFIED.
     * The row stays share-locked for the rest of the caller's transaction; status updates
     * lock it exclusively, so a revocation waits for the claim to commit.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Channel lockVerifiedOwnedBy(UUID channelId, UUID ownerId) {
        Channel channel = channelRepository.findByIdForShare(channelId)
            .map(ChannelEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Channel not found: " + channelId));
        if (!channel.isOwnedBy(ownerId)) {
            throw new VerificationFailedException(
                "Channel " + channelId + " is not owned by " + ownerId);
        }
        if (!channel.isVerified()) {
            throw new VerificationFailedException(
                "Channel " + channelId + " is " + channel.getStatus() + ", not VERIFIED");
        }
        return channel;
    }

    @Transactional(readOnly = true)
    public List<UUID> findIdsByStatus(Collection<ChannelStatus> statuses) {
        return channelRepository.findIdsByStatusIn(statuses);
    }

    /**
     * Applies {@code change} to the channel under its row lock.
     * A status change publishes {@link ChannelStatusChangedEvent} within the transaction.
     */
    @Transactional
    public ChannelUpdate update(UUID channelId, UnaryOperator<Channel> change) {
        ChannelEntity entity = channelRepository.findByIdForUpdate(channelId)
            .orElseThrow(() -> new NotFoundException("Channel not found: " + channelId));
        Channel before = entity.toDomain();
        Channel after = change.apply(before);

        entity.updateFromDomain(after);
        channelRepository.save(entity);

        if (before.getStatus() != after.getStatus()) {
            log.info("Channel status changed: channelId={}, {} -> {}", channelId, before.getStatus(), after.getStatus());
            eventPublisher.publishEvent(new ChannelStatusChangedEvent(
                channelId, after.getOwnerId(), before.getStatus(), after.getStatus()));
        }
        return new ChannelUpdate(before, after);
    }

    @Value
    public static class ChannelUpdate {
        Channel before;
        Channel after;
    }
}
