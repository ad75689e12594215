package com.give.payout.domain.exception;

/**
 * Failure raised by any payout router operation.
 * The call that raised it has no partial effect.
 */
public class PayoutException extends RuntimeException {

    private final PayoutErrorCode code;

    public PayoutException(PayoutErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public PayoutException(PayoutErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public PayoutErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }
}
