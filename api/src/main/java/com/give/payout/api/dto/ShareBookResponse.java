package com.give.payout.api.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

@Value
@Builder
public class ShareBookResponse {
    String asset;
    BigInteger totalShares;
    List<String> activeStakeholders;
}
