package com.give.payout.infrastructure.persistence.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.give.payout.domain.model.ShareBook;
import com.give.payout.domain.store.ShareLedgerStore;
import com.give.payout.infrastructure.persistence.entity.ShareBookSnapshotEntity;
import com.give.payout.infrastructure.persistence.repository.ShareBookSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Share books stored as JSON snapshots, one row per asset
 */
@Component
public class JpaShareLedgerStore implements ShareLedgerStore {

    private static final Logger log = LoggerFactory.getLogger(JpaShareLedgerStore.class);

    private final ShareBookSnapshotRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JpaShareLedgerStore(ShareBookSnapshotRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ShareBook load(String asset) {
        return repository.findById(asset)
                .map(this::toBook)
                .orElseGet(() -> new ShareBook(asset));
    }

    @Override
    public void save(ShareBook book) {
        ShareBookSnapshotEntity entity = repository.findById(book.getAsset())
                .orElseGet(() -> ShareBookSnapshotEntity.builder().asset(book.getAsset()).build());
        try {
            entity.setSnapshotData(objectMapper.writeValueAsString(book));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize share book for " + book.getAsset(), e);
        }
        entity.setTotalShares(book.getTotalShares());
        entity.setActiveCount(book.getActiveCount());
        entity.setUpdatedAt(OffsetDateTime.now(clock));
        repository.save(entity);
        log.debug("Saved share book {}: total={}, active={}", book.getAsset(), book.getTotalShares(), book.getActiveCount());
    }

    private ShareBook toBook(ShareBookSnapshotEntity entity) {
        try {
            return objectMapper.readValue(entity.getSnapshotData(), ShareBook.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt share book snapshot for " + entity.getAsset(), e);
        }
    }
}
