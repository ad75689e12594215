package com.give.payout.application.service;

/**
 * Thrown when a vault event turns out to be processed already once its
 * operation holds the execution guard.
 */
public class DuplicateVaultEventException extends RuntimeException {

    private final String eventId;

    public DuplicateVaultEventException(String eventId) {
        super("Vault event " + eventId + " already processed");
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
