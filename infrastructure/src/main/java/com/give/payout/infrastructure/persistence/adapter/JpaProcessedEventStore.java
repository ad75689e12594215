package com.give.payout.infrastructure.persistence.adapter;

import com.give.payout.domain.store.ProcessedEventStore;
import com.give.payout.infrastructure.persistence.entity.ProcessedEventEntity;
import com.give.payout.infrastructure.persistence.repository.ProcessedEventRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

@Component
public class JpaProcessedEventStore implements ProcessedEventStore {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final ProcessedEventRepository repository;
    private final Clock clock;

    public JpaProcessedEventStore(ProcessedEventRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public String findStatus(String eventId) {
        return repository.findById(eventId).map(ProcessedEventEntity::getStatus).orElse(null);
    }

    /**
     * Upsert: a failed event that is redelivered and succeeds overwrites its FAILED row
     */
    @Override
    @Transactional
    public void record(String eventId, String eventType, String status, String error) {
        ProcessedEventEntity entity = repository.findById(eventId)
                .orElseGet(() -> ProcessedEventEntity.builder().eventId(eventId).build());
        entity.setEventType(eventType);
        entity.setStatus(status);
        entity.setError(error != null && error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error);
        entity.setProcessedAt(OffsetDateTime.now(clock));
        repository.save(entity);
    }
}
