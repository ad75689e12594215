package com.give.payout.domain.model;

import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;

import java.math.BigInteger;

/**
 * Range checks for unsigned 256-bit token amounts.
 * Values never wrap: anything outside [0, 2^256 - 1] is rejected.
 */
public final class UInt256 {

    public static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private UInt256() {
    }

    public static boolean isInRange(BigInteger value) {
        return value != null && value.signum() >= 0 && value.compareTo(MAX_VALUE) <= 0;
    }

    /**
     * @return the value itself when in range
     * @throws PayoutException ARITHMETIC_OVERFLOW otherwise
     */
    public static BigInteger checked(BigInteger value, String field) {
        if (value == null) {
            throw new PayoutException(PayoutErrorCode.ARITHMETIC_OVERFLOW, field + " is required");
        }
        if (!isInRange(value)) {
            throw new PayoutException(PayoutErrorCode.ARITHMETIC_OVERFLOW,
                    field + " " + value + " is outside the uint256 range");
        }
        return value;
    }
}
