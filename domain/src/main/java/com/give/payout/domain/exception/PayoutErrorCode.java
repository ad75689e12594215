package com.give.payout.domain.exception;

/**
 * Named failure reasons returned by every entry point of the payout router
 */
public enum PayoutErrorCode {
    // Input validation
    ZERO_ADDRESS(ErrorCategory.VALIDATION, false),
    ZERO_AMOUNT(ErrorCategory.VALIDATION, false),
    INVALID_SPLIT_PERCENT(ErrorCategory.VALIDATION, false),
    EMPTY_BENEFICIARY_LIST(ErrorCategory.VALIDATION, false),
    CONFIG_OUT_OF_BOUNDS(ErrorCategory.VALIDATION, false),
    ARITHMETIC_OVERFLOW(ErrorCategory.VALIDATION, false),
    ALREADY_PAUSED(ErrorCategory.VALIDATION, false),
    NOT_PAUSED(ErrorCategory.VALIDATION, false),

    // Authorization
    UNAUTHORIZED_CALLER(ErrorCategory.AUTHORIZATION, false),
    MISSING_ROLE(ErrorCategory.AUTHORIZATION, false),

    // Domain state
    UNAPPROVED_BENEFICIARY(ErrorCategory.DOMAIN_STATE, false),
    NO_BENEFICIARY_CONFIGURED(ErrorCategory.DOMAIN_STATE, false),
    INSUFFICIENT_BALANCE(ErrorCategory.DOMAIN_STATE, true),
    TRANSFER_FAILED(ErrorCategory.DOMAIN_STATE, true),

    // System
    SYSTEM_PAUSED(ErrorCategory.SYSTEM, true),
    REENTRANT_CALL(ErrorCategory.SYSTEM, false),
    LEDGER_BUSY(ErrorCategory.SYSTEM, true),
    REGISTRY_UNAVAILABLE(ErrorCategory.SYSTEM, true);

    private final ErrorCategory category;
    private final boolean retryable;

    PayoutErrorCode(ErrorCategory category, boolean retryable) {
        this.category = category;
        this.retryable = retryable;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
