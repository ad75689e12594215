package com.give.payout.domain.model;

public enum RecipientKind {
    BENEFICIARY,
    FEE_RECIPIENT,       // configurable fee and fallback treasury
    PROTOCOL_TREASURY,
    EMERGENCY
}
