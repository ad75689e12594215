package com.give.payout.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Moves a stranded custody balance to {@code recipient}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmergencyWithdrawRequest {
    private String recipient;
    private BigInteger amount;
}
