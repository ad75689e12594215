package com.give.payout.application.service;

import com.give.payout.domain.model.FeeSplit;
import com.give.payout.domain.model.UInt256;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Integer arithmetic shared by all distribution modes.
 * Every division truncates toward zero; callers account for the remainder.
 */
@Component
public class FeeCalculator {

    public static final int BPS_DENOMINATOR = 10_000;
    public static final int PERCENT_DENOMINATOR = 100;

    private static final BigInteger BPS = BigInteger.valueOf(BPS_DENOMINATOR);
    private static final BigInteger PERCENT = BigInteger.valueOf(PERCENT_DENOMINATOR);

    /**
     * floor(amount * bps / 10_000)
     */
    public BigInteger applyBps(BigInteger amount, int bps) {
        checkRate(bps, BPS_DENOMINATOR, "bps");
        return UInt256.checked(amount, "amount").multiply(BigInteger.valueOf(bps)).divide(BPS);
    }

    /**
     * Fee taken at {@code feeBps}, the rest is net
     */
    public FeeSplit splitFee(BigInteger amount, int feeBps) {
        BigInteger fee = applyBps(amount, feeBps);
        return new FeeSplit(amount, fee, amount.subtract(fee));
    }

    /**
     * floor(amount * percent / 100)
     */
    public BigInteger applyPercent(BigInteger amount, int percent) {
        checkRate(percent, PERCENT_DENOMINATOR, "percent");
        return UInt256.checked(amount, "amount").multiply(BigInteger.valueOf(percent)).divide(PERCENT);
    }

    /**
     * floor(total * part / whole)
     */
    public BigInteger proRata(BigInteger total, BigInteger part, BigInteger whole) {
        if (whole == null || whole.signum() <= 0) {
            throw new IllegalArgumentException("whole must be positive");
        }
        if (part.compareTo(whole) > 0) {
            throw new IllegalArgumentException("part " + part + " exceeds whole " + whole);
        }
        return UInt256.checked(total, "total").multiply(UInt256.checked(part, "part")).divide(whole);
    }

    /**
     * Equal integer parts; the truncation remainder goes to the first part
     */
    public List<BigInteger> splitEvenly(BigInteger amount, int parts) {
        if (parts <= 0) {
            throw new IllegalArgumentException("parts must be positive");
        }
        BigInteger[] quotientAndRemainder = UInt256.checked(amount, "amount").divideAndRemainder(BigInteger.valueOf(parts));
        List<BigInteger> result = new ArrayList<>(parts);
        result.add(quotientAndRemainder[0].add(quotientAndRemainder[1]));
        for (int i = 1; i < parts; i++) {
            result.add(quotientAndRemainder[0]);
        }
        return result;
    }

    private static void checkRate(int rate, int denominator, String name) {
        if (rate < 0 || rate > denominator) {
            throw new IllegalArgumentException(name + " " + rate + " outside [0, " + denominator + "]");
        }
    }
}
