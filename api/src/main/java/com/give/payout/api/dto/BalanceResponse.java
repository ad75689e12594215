package com.give.payout.api.dto;

import lombok.Value;

import java.math.BigInteger;

/**
 * Amount held for a subject (stakeholder shares or custody balance)
 */
@Value
public class BalanceResponse {
    String asset;
    String holder;
    BigInteger amount;
}
