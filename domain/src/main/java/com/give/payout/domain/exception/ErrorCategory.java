package com.give.payout.domain.exception;

/**
 * Coarse failure classes, used by integrators to decide between
 * "fix input", "not entitled" and "retry later".
 */
public enum ErrorCategory {
    VALIDATION,
    AUTHORIZATION,
    DOMAIN_STATE,
    SYSTEM
}
