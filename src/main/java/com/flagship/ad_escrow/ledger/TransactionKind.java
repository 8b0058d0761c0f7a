package com.flagship.ad_escrow.ledger;

/**
 * Ledger transaction kinds. The kind fixes the sign of the amount.
 */
public enum TransactionKind {
    DEBIT_ESCROW(false),
    CREDIT_PAYOUT(true),
    REFUND(true),
    TOPUP(true);

    private final boolean credit;

    TransactionKind(boolean credit) {
        this.credit = credit;
    }

    public boolean isCredit() {
        return credit;
    }

    public boolean isDebit() {
        return !credit;
    }
}
