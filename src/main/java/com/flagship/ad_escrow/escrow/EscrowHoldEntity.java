package com.flagship.ad_escrow.escrow;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "escrow_holds")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EscrowHoldEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    /**
     * Unique: a campaign never has more than one hold.
     */
    @Column(name = "campaign_id", nullable = false, unique = true, updatable = false)
    private UUID campaignId;

    @Column(name = "advertiser_id", nullable = false, updatable = false)
    private UUID advertiserId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EscrowHoldStatus status;

    @Column(name = "payee_id")
    private UUID payeeId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "finalized_at")
    private Instant finalizedAt;

    static EscrowHoldEntity fromDomain(EscrowHold hold) {
        return new EscrowHoldEntity(
            hold.getId(),
            hold.getCampaignId(),
            hold.getAdvertiserId(),
            hold.getAmount(),
            hold.getStatus(),
            hold.getPayeeId(),
            hold.getCreatedAt(),
            hold.getFinalizedAt()
        );
    }

    EscrowHold toDomain() {
        return new EscrowHold(id, campaignId, advertiserId, amount, status, payeeId, createdAt, finalizedAt);
    }

    void updateFromDomain(EscrowHold hold) {
        if (this.status != EscrowHoldStatus.HELD) {
            throw new IllegalStateException("Escrow hold " + id + " is already finalized as " + this.status);
        }
        this.status = hold.getStatus();
        this.payeeId = hold.getPayeeId();
        this.finalizedAt = hold.getFinalizedAt();
    }
}
