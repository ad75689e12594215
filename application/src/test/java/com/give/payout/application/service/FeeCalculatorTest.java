package com.give.payout.application.service;

import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import com.give.payout.domain.model.FeeSplit;
import com.give.payout.domain.model.UInt256;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeeCalculatorTest {

    private final FeeCalculator calculator = new FeeCalculator();

    @Test
    void testApplyBpsTruncates() {
        assertEquals(BigInteger.valueOf(7), calculator.applyBps(BigInteger.valueOf(300), 250));
        assertEquals(BigInteger.ZERO, calculator.applyBps(BigInteger.valueOf(39), 250));
        assertEquals(BigInteger.valueOf(1000), calculator.applyBps(BigInteger.valueOf(1000), 10_000));
    }

    @Test
    void testSplitFeeConservesAmount() {
        FeeSplit split = calculator.splitFee(BigInteger.valueOf(1001), 100);

        assertEquals(BigInteger.valueOf(10), split.getFee());
        assertEquals(BigInteger.valueOf(991), split.getNet());
        assertEquals(split.getGross(), split.getFee().add(split.getNet()));
    }

    @Test
    void testApplyPercent() {
        assertEquals(BigInteger.valueOf(731), calculator.applyPercent(BigInteger.valueOf(975), 75));
        assertEquals(BigInteger.valueOf(975), calculator.applyPercent(BigInteger.valueOf(975), 100));
    }

    @Test
    void testProRataAtFullWidthDoesNotOverflow() {
        BigInteger result = calculator.proRata(UInt256.MAX_VALUE, UInt256.MAX_VALUE, UInt256.MAX_VALUE);

        assertEquals(UInt256.MAX_VALUE, result);
    }

    @Test
    void testProRataRejectsPartAboveWhole() {
        assertThrows(IllegalArgumentException.class,
                () -> calculator.proRata(BigInteger.TEN, BigInteger.valueOf(5), BigInteger.valueOf(4)));
        assertThrows(IllegalArgumentException.class,
                () -> calculator.proRata(BigInteger.TEN, BigInteger.ONE, BigInteger.ZERO));
    }

    @Test
    void testSplitEvenlyPutsRemainderFirst() {
        List<BigInteger> parts = calculator.splitEvenly(BigInteger.valueOf(10), 3);

        assertEquals(List.of(BigInteger.valueOf(4), BigInteger.valueOf(3), BigInteger.valueOf(3)), parts);
    }

    @Test
    void testRatesOutsideRangeRejected() {
        assertThrows(IllegalArgumentException.class, () -> calculator.applyBps(BigInteger.TEN, 10_001));
        assertThrows(IllegalArgumentException.class, () -> calculator.applyPercent(BigInteger.TEN, -1));
        assertThrows(IllegalArgumentException.class, () -> calculator.splitEvenly(BigInteger.TEN, 0));
    }

    @Test
    void testOutOfRangeAmountRejected() {
        PayoutException ex = assertThrows(PayoutException.class,
                () -> calculator.applyBps(BigInteger.valueOf(-1), 100));

        assertEquals(PayoutErrorCode.ARITHMETIC_OVERFLOW, ex.getCode());
    }
}
