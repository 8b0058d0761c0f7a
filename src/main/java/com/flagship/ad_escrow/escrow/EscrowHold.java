package com.flagship.ad_escrow.escrow;

import com.flagship.ad_escrow.error.InvalidTransitionException;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Advertiser funds held against one campaign.
 * Created HELD, finalized exactly once: RELEASED to a payee or REFUNDED to the advertiser.
 */
@Value
public class EscrowHold {
    UUID id;
    UUID campaignId;
    UUID advertiserId;
    long amount;
    EscrowHoldStatus status;
    UUID payeeId;
    Instant createdAt;
    Instant finalizedAt;

    public static EscrowHold hold(UUID id, UUID campaignId, UUID advertiserId, long amount, Instant now) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Escrow amount must be positive: " + amount);
        }
        return new EscrowHold(id, campaignId, advertiserId, amount, EscrowHoldStatus.HELD, null, now, null);
    }

    public EscrowHold release(UUID payee, Instant now) {
        if (status != EscrowHoldStatus.HELD) {
            throw new InvalidTransitionException(
                String.format("Cannot release escrow hold %s in %s status", id, status));
        }
        return new EscrowHold(id, campaignId, advertiserId, amount, EscrowHoldStatus.RELEASED, payee, createdAt, now);
    }

    public EscrowHold refund(Instant now) {
        if (status != EscrowHoldStatus.HELD) {
            throw new InvalidTransitionException(
                String.format("Cannot refund escrow hold %s in %s status", id, status));
        }
        return new EscrowHold(id, campaignId, advertiserId, amount, EscrowHoldStatus.REFUNDED, null, createdAt, now);
    }

    public boolean isFinalized() {
        return status != EscrowHoldStatus.HELD;
    }

    String holdReference() {
        return "escrow-hold:" + campaignId;
    }

    String releaseReference() {
        return "escrow-release:" + id;
    }

    String refundReference() {
        return "escrow-refund:" + id;
    }
}
