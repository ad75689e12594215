package com.give.payout.infrastructure.persistence.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.give.payout.domain.event.AuditEvent;
import com.give.payout.domain.store.AuditEventStore;
import com.give.payout.infrastructure.persistence.entity.AuditEventEntity;
import com.give.payout.infrastructure.persistence.repository.AuditEventRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

@Component
public class JpaAuditEventStore implements AuditEventStore {

    private final AuditEventRepository repository;
    private final ObjectMapper objectMapper;

    public JpaAuditEventStore(AuditEventRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(AuditEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit event " + event.getEventId(), e);
        }
        repository.save(AuditEventEntity.builder()
                .eventId(event.getEventId())
                .eventType(event.getType().name())
                .asset(event.getAsset())
                .actor(event.getActor())
                .correlationId(event.getCorrelationId())
                .payload(payload)
                .occurredAt(event.getOccurredAt().atOffset(ZoneOffset.UTC))
                .build());
    }

    @Override
    public List<AuditEvent> findRecent(String asset, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        List<AuditEventEntity> rows = asset != null
                ? repository.findByAssetOrderByIdDesc(asset, page)
                : repository.findAllByOrderByIdDesc(page);
        return rows.stream().map(this::toEvent).collect(Collectors.toList());
    }

    private AuditEvent toEvent(AuditEventEntity entity) {
        try {
            return objectMapper.readValue(entity.getPayload(), AuditEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt audit event " + entity.getEventId(), e);
        }
    }
}
