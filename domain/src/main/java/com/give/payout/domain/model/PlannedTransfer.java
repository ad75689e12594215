package com.give.payout.domain.model;

import lombok.Value;

import java.math.BigInteger;

@Value
public class PlannedTransfer {
    String recipient;
    BigInteger amount;
    RecipientKind kind;
}
