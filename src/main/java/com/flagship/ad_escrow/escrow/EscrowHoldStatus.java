package com.flagship.ad_escrow.escrow;

public enum EscrowHoldStatus {
    HELD,
    RELEASED,
    REFUNDED
}
