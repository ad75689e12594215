package com.give.payout.api.dto;

import lombok.Value;

import java.util.Set;

@Value
public class RouterStatusResponse {
    boolean paused;
    Set<String> authorizedCallers;
    Set<Integer> acceptedSplits;
}
