package com.give.payout.domain.store;

/**
 * Idempotency records for inbound vault events
 */
public interface ProcessedEventStore {

    /**
     * @return status recorded for the event, or null when never seen
     */
    String findStatus(String eventId);

    void record(String eventId, String eventType, String status, String error);
}
