package com.give.payout.application.service;

import lombok.Value;

import java.util.List;

@Value
public class VaultEventOutcome {

    public enum Status { PROCESSED, DUPLICATE, REJECTED }

    Status status;
    List<String> errors;

    public static VaultEventOutcome processed() {
        return new VaultEventOutcome(Status.PROCESSED, List.of());
    }

    public static VaultEventOutcome duplicate() {
        return new VaultEventOutcome(Status.DUPLICATE, List.of());
    }

    public static VaultEventOutcome rejected(List<String> errors) {
        return new VaultEventOutcome(Status.REJECTED, List.copyOf(errors));
    }
}
