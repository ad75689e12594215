package com.give.payout.domain.store;

import com.give.payout.domain.event.AuditEvent;

import java.util.List;

/**
 * Append-only audit log
 */
public interface AuditEventStore {

    void append(AuditEvent event);

    /**
     * Most recent first
     */
    List<AuditEvent> findRecent(String asset, int limit);
}
