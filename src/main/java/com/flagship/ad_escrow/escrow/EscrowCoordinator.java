package com.flagship.ad_escrow.escrow;

import com.flagship.ad_escrow.campaign.Campaign;
import com.flagship.ad_escrow.error.InsufficientFundsException;
import com.flagship.ad_escrow.error.InvalidTransitionException;
import com.flagship.ad_escrow.error.NotFoundException;
import com.flagship.ad_escrow.ledger.LedgerService;
import com.flagship.ad_escrow.ledger.LedgerTransaction;
import com.flagship.ad_escrow.ledger.TransactionKind;
import com.flagship.ad_escrow.observability.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Holds advertiser funds against a campaign and finalizes them exactly once.
 *
 * Key principles:
 * - The hold debit and the hold row are written in the fund transition's transaction
 * - Release and refund lock the hold row; its own status is the only guard
 * - A repeated release (or refund) returns the original ledger transaction
 * - Release after refund, or refund after release, is an {@link InvalidTransitionException}
 *
 * Lock order is campaign, then hold, then user; callers must not lock users first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowCoordinator {

    private final EscrowHoldRepository holdRepository;
    private final LedgerService ledgerService;
    private final EngineMetrics metrics;
    private final Clock clock;

    /**
     * Debits the advertiser by the campaign budget and records the hold.
     * Must join the transaction of the PENDING_FUNDING -> FUNDED transition.
     *
     * @throws InsufficientFundsException if the advertiser cannot cover the budget; nothing is written
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public EscrowHold hold(Campaign campaign) {
        if (holdRepository.existsByCampaignId(campaign.getId())) {
            throw new InvalidTransitionException("Campaign " + campaign.getId() + " already has an escrow hold");
        }

        EscrowHold hold = EscrowHold.hold(UUID.randomUUID(), campaign.getId(), campaign.getAdvertiserId(),
                campaign.getBudget(), clock.instant());
        try {
            ledgerService.debit(hold.getAdvertiserId(), hold.getAmount(), hold.holdReference(),
                    TransactionKind.DEBIT_ESCROW);
        } catch (InsufficientFundsException e) {
            metrics.recordEscrowOperation("hold", "insufficient_funds");
            log.info("Escrow hold rejected: campaignId={}, required={}, available={}",
                    campaign.getId(), e.getRequired(), e.getAvailable());
            throw e;
        }
        holdRepository.save(EscrowHoldEntity.fromDomain(hold));

        metrics.recordEscrowOperation("hold", "success");
        log.info("Escrow hold created: holdId={}, campaignId={}, amount={}",
                hold.getId(), hold.getCampaignId(), hold.getAmount());
        return hold;
    }

    /**
     * Pays the held amount to {@code payeeId}.
     */
    @Transactional
    public LedgerTransaction release(UUID holdId, UUID payeeId) {
        EscrowHoldEntity entity = lockHold(holdId);
        EscrowHold hold = entity.toDomain();

        if (hold.getStatus() == EscrowHoldStatus.RELEASED) {
            log.debug("Escrow hold already released: holdId={}", holdId);
            metrics.recordEscrowOperation("release", "duplicate");
            return originalTransaction(hold.releaseReference(), TransactionKind.CREDIT_PAYOUT, holdId);
        }
        if (hold.getStatus() == EscrowHoldStatus.REFUNDED) {
            metrics.recordEscrowOperation("release", "rejected");
            throw new InvalidTransitionException("Escrow hold " + holdId + " was already refunded");
        }

        LedgerTransaction credit = ledgerService.credit(payeeId, hold.getAmount(), hold.releaseReference(),
                TransactionKind.CREDIT_PAYOUT);
        entity.updateFromDomain(hold.release(payeeId, clock.instant()));
        holdRepository.save(entity);

        metrics.recordEscrowOperation("release", "success");
        log.info("Escrow hold released: holdId={}, campaignId={}, payeeId={}, amount={}",
                holdId, hold.getCampaignId(), payeeId, hold.getAmount());
        return credit;
    }

    /**
     * Returns the held amount to the advertiser.
     */
    @Transactional
    public LedgerTransaction refund(UUID holdId) {
        EscrowHoldEntity entity = lockHold(holdId);
        EscrowHold hold = entity.toDomain();

        if (hold.getStatus() == EscrowHoldStatus.REFUNDED) {
            log.debug("Escrow hold already refunded: holdId={}", holdId);
            metrics.recordEscrowOperation("refund", "duplicate");
            return originalTransaction(hold.refundReference(), TransactionKind.REFUND, holdId);
        }
        if (hold.getStatus() == EscrowHoldStatus.RELEASED) {
            metrics.recordEscrowOperation("refund", "rejected");
            throw new InvalidTransitionException("Escrow hold " + holdId + " was already released");
        }

        LedgerTransaction credit = ledgerService.credit(hold.getAdvertiserId(), hold.getAmount(),
                hold.refundReference(), TransactionKind.REFUND);
        entity.updateFromDomain(hold.refund(clock.instant()));
        holdRepository.save(entity);

        metrics.recordEscrowOperation("refund", "success");
        log.info("Escrow hold refunded: holdId={}, campaignId={}, advertiserId={}, amount={}",
                holdId, hold.getCampaignId(), hold.getAdvertiserId(), hold.getAmount());
        return credit;
    }

    @Transactional(readOnly = true)
    public Optional<EscrowHold> findByCampaignId(UUID campaignId) {
        return holdRepository.findByCampaignId(campaignId).map(EscrowHoldEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<EscrowHold> findById(UUID holdId) {
        return holdRepository.findById(holdId).map(EscrowHoldEntity::toDomain);
    }

    private EscrowHoldEntity lockHold(UUID holdId) {
        return holdRepository.findByIdForUpdate(holdId)
            .orElseThrow(() -> new NotFoundException("Escrow hold not found: " + holdId));
    }

    private LedgerTransaction originalTransaction(String reference, TransactionKind kind, UUID holdId) {
        return ledgerService.findByReference(reference, kind)
            .orElseThrow(() -> new IllegalStateException(
                "Escrow hold " + holdId + " is finalized but has no " + kind + " transaction"));
    }
}
