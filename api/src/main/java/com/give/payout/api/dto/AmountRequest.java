package com.give.payout.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Deposit, harvest or single-beneficiary distribution amount
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AmountRequest {
    private BigInteger amount;
}
