package com.give.payout.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EqualSplitRequest {
    private BigInteger amount;
    private List<String> beneficiaries;
}
