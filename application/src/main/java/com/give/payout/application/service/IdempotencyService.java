package com.give.payout.application.service;

import com.give.payout.domain.event.VaultEvent;
import com.give.payout.domain.store.ProcessedEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Prevents duplicate processing of vault events.
 * Failed events are recorded but may be processed again on redelivery.
 */
@Service
public class IdempotencyService {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyService.class);

    static final String STATUS_PROCESSED = "PROCESSED";
    static final String STATUS_FAILED = "FAILED";

    private final ProcessedEventStore processedEventStore;

    public IdempotencyService(ProcessedEventStore processedEventStore) {
        this.processedEventStore = processedEventStore;
    }

    public boolean isProcessed(String eventId) {
        if (eventId == null || eventId.isEmpty()) {
            return false;
        }
        boolean processed = STATUS_PROCESSED.equals(processedEventStore.findStatus(eventId));
        if (processed) {
            log.debug("Vault event {} already processed", eventId);
        }
        return processed;
    }

    public void markAsProcessed(VaultEvent event) {
        processedEventStore.record(event.getEventId(), event.getType().name(), STATUS_PROCESSED, null);
        log.debug("Marked vault event {} as processed", event.getEventId());
    }

    /**
     * Mark the event processed, failing with {@link DuplicateVaultEventException}
     * if another delivery already did. Meant to run inside the transaction of the
     * routed operation so the marker commits with it.
     */
    public void claim(VaultEvent event) {
        if (isProcessed(event.getEventId())) {
            throw new DuplicateVaultEventException(event.getEventId());
        }
        markAsProcessed(event);
    }

    public void markAsFailed(VaultEvent event, String error) {
        processedEventStore.record(event.getEventId(), event.getType().name(), STATUS_FAILED, error);
        log.warn("Marked vault event {} as failed: {}", event.getEventId(), error);
    }
}
