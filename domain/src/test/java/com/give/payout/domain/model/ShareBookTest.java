package com.give.payout.domain.model;

import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ShareBookTest {

    private static final String ASSET = "USDC";

    @Test
    void testFirstNonzeroWriteJoinsIndex() {
        ShareBook book = new ShareBook(ASSET);

        ShareChange change = book.setShares("alice", BigInteger.valueOf(50));

        assertEquals(MembershipChange.JOINED, change.getMembership());
        assertEquals(BigInteger.ZERO, change.getOldAmount());
        assertEquals(BigInteger.valueOf(50), book.getTotalShares());
        assertEquals(List.of("alice"), book.getActiveStakeholders());
        assertTrue(book.isConsistent());
    }

    @Test
    void testWriteToZeroLeavesIndex() {
        ShareBook book = new ShareBook(ASSET);
        book.setShares("alice", BigInteger.valueOf(50));

        ShareChange change = book.setShares("alice", BigInteger.ZERO);

        assertEquals(MembershipChange.LEFT, change.getMembership());
        assertEquals(BigInteger.ZERO, book.getTotalShares());
        assertTrue(book.getActiveStakeholders().isEmpty());
        assertFalse(book.isActive("alice"));
        assertEquals(BigInteger.ZERO, book.sharesOf("alice"));
        assertTrue(book.isConsistent());
    }

    @Test
    void testRepeatedIdenticalWriteIsNoOp() {
        ShareBook book = new ShareBook(ASSET);
        book.setShares("alice", BigInteger.valueOf(70));
        book.setShares("bob", BigInteger.valueOf(30));

        ShareChange change = book.setShares("alice", BigInteger.valueOf(70));

        assertTrue(change.isNoOp());
        assertEquals(MembershipChange.UNCHANGED, change.getMembership());
        assertEquals(BigInteger.valueOf(100), book.getTotalShares());
        assertEquals(2, book.getActiveCount());
        assertTrue(book.isConsistent());
    }

    @Test
    void testZeroToZeroWriteDoesNotJoin() {
        ShareBook book = new ShareBook(ASSET);

        ShareChange change = book.setShares("ghost", BigInteger.ZERO);

        assertEquals(MembershipChange.UNCHANGED, change.getMembership());
        assertEquals(0, book.getActiveCount());
        assertTrue(book.isConsistent());
    }

    @Test
    void testResizeAdjustsTotalByDelta() {
        ShareBook book = new ShareBook(ASSET);
        book.setShares("alice", BigInteger.valueOf(300));
        book.setShares("bob", BigInteger.valueOf(700));

        book.setShares("alice", BigInteger.valueOf(100));

        assertEquals(BigInteger.valueOf(800), book.getTotalShares());
        assertEquals(MembershipChange.UNCHANGED, book.setShares("bob", BigInteger.valueOf(900)).getMembership());
        assertEquals(BigInteger.valueOf(1000), book.getTotalShares());
        assertTrue(book.isConsistent());
    }

    @Test
    void testRemovalSwapsLastIntoVacatedSlot() {
        ShareBook book = new ShareBook(ASSET);
        book.setShares("a", BigInteger.ONE);
        book.setShares("b", BigInteger.ONE);
        book.setShares("c", BigInteger.ONE);
        book.setShares("d", BigInteger.ONE);

        book.setShares("b", BigInteger.ZERO);

        assertEquals(List.of("a", "d", "c"), book.getActiveStakeholders());
        assertTrue(book.isConsistent());

        book.setShares("c", BigInteger.ZERO);
        assertEquals(List.of("a", "d"), book.getActiveStakeholders());
        assertTrue(book.isConsistent());
    }

    @Test
    void testRejoinAfterExitAppearsOnce() {
        ShareBook book = new ShareBook(ASSET);

        book.setShares("alice", BigInteger.valueOf(50));
        book.setShares("alice", BigInteger.ZERO);
        book.setShares("alice", BigInteger.valueOf(50));

        assertEquals(List.of("alice"), book.getActiveStakeholders());
        assertEquals(BigInteger.valueOf(50), book.getTotalShares());
        assertTrue(book.isConsistent());
    }

    @Test
    void testOutOfRangeWriteRejectedWithoutEffect() {
        ShareBook book = new ShareBook(ASSET);
        book.setShares("alice", UInt256.MAX_VALUE);

        PayoutException ex = assertThrows(PayoutException.class,
                () -> book.setShares("bob", BigInteger.ONE));

        assertEquals(PayoutErrorCode.ARITHMETIC_OVERFLOW, ex.getCode());
        assertEquals(UInt256.MAX_VALUE, book.getTotalShares());
        assertFalse(book.isActive("bob"));
        assertTrue(book.isConsistent());
    }

    @Test
    void testNegativeAmountRejected() {
        ShareBook book = new ShareBook(ASSET);

        PayoutException ex = assertThrows(PayoutException.class,
                () -> book.setShares("alice", BigInteger.valueOf(-1)));

        assertEquals(PayoutErrorCode.ARITHMETIC_OVERFLOW, ex.getCode());
        assertEquals(0, book.getActiveCount());
    }

    @Test
    void testRebuiltBookRestoresIndexLookup() {
        ShareBook book = new ShareBook(ASSET);
        book.setShares("a", BigInteger.valueOf(5));
        book.setShares("b", BigInteger.valueOf(6));

        Map<String, BigInteger> shares = new HashMap<>();
        shares.put("a", BigInteger.valueOf(5));
        shares.put("b", BigInteger.valueOf(6));
        ShareBook restored = new ShareBook(ASSET, BigInteger.valueOf(11), shares,
                new ArrayList<>(book.getActiveStakeholders()));

        restored.setShares("a", BigInteger.ZERO);

        assertEquals(List.of("b"), restored.getActiveStakeholders());
        assertTrue(restored.isConsistent());
    }

    @Test
    void testInvariantsHoldUnderRandomWrites() {
        ShareBook book = new ShareBook(ASSET);
        Map<String, BigInteger> expected = new HashMap<>();
        Random random = new Random(42);

        for (int i = 0; i < 2_000; i++) {
            String stakeholder = "s" + random.nextInt(25);
            BigInteger amount = random.nextInt(4) == 0
                    ? BigInteger.ZERO
                    : BigInteger.valueOf(random.nextInt(1_000));
            book.setShares(stakeholder, amount);
            expected.put(stakeholder, amount);

            assertTrue(book.isConsistent(), "inconsistent after write " + i);
        }

        BigInteger expectedTotal = expected.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
        assertEquals(expectedTotal, book.getTotalShares());
        expected.forEach((stakeholder, amount) -> {
            assertEquals(amount, book.sharesOf(stakeholder));
            assertEquals(amount.signum() > 0, book.isActive(stakeholder));
        });
    }
}
