package com.give.payout.domain.custody;

import java.math.BigInteger;

/**
 * Asset movement primitive. Every failure is loud: INSUFFICIENT_BALANCE when
 * the sender cannot cover the amount, TRANSFER_FAILED when the receiver rejects.
 */
public interface AssetTransferService {

    BigInteger balanceOf(String asset, String holder);

    void transfer(String asset, String from, String to, BigInteger amount);

    /**
     * Credit a holder from outside the ledger (vault funding)
     */
    void deposit(String asset, String holder, BigInteger amount);
}
