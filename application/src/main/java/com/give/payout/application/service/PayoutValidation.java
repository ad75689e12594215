package com.give.payout.application.service;

import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import com.give.payout.domain.model.UInt256;

import java.math.BigInteger;

/**
 * Input checks shared by the router services. All of them run before any state change.
 */
public final class PayoutValidation {

    private PayoutValidation() {
    }

    public static String requireAddress(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new PayoutException(PayoutErrorCode.ZERO_ADDRESS, field + " must not be empty");
        }
        return value;
    }

    /**
     * Payout destinations must be outside the router's own custody account, or
     * every transfer to them would be a transfer to itself.
     */
    public static String requireNotCustody(String address, String custodyAccount, String field) {
        if (address.equals(custodyAccount)) {
            throw new PayoutException(PayoutErrorCode.CONFIG_OUT_OF_BOUNDS,
                    field + " must not be the custody account " + custodyAccount);
        }
        return address;
    }

    public static BigInteger requirePositiveAmount(BigInteger amount, String field) {
        if (amount == null || amount.signum() == 0) {
            throw new PayoutException(PayoutErrorCode.ZERO_AMOUNT, field + " must be greater than zero");
        }
        return UInt256.checked(amount, field);
    }
}
