package com.give.payout.domain.model;

import lombok.Value;

import java.math.BigInteger;

/**
 * Gross amount split into fee and net, with {@code fee + net == gross}
 */
@Value
public class FeeSplit {
    BigInteger gross;
    BigInteger fee;
    BigInteger net;
}
