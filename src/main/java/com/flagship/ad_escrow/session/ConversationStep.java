package com.flagship.ad_escrow.session;

/**
 * Where a user is in the front end's registration or campaign-creation dialogue.
 */
public enum ConversationStep {
    IDLE,
    AWAITING_ROLE,
    AWAITING_CHANNEL_INFO,
    AWAITING_CHANNEL_VERIFICATION,
    AWAITING_AD_TEXT,
    AWAITING_BUDGET,
    AWAITING_CONFIRMATION
}
