package com.flagship.ad_escrow.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable ledger entry. Debits carry a negative amount.
 * (reference, kind) is unique across the whole ledger.
 */
@Value
public class LedgerTransaction {
    UUID id;
    UUID actorId;
    long amount;
    TransactionKind kind;
    String reference;
    Instant createdAt;
    Long sequenceNumber;
}
