package com.give.payout.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.OffsetDateTime;

/**
 * JSON snapshot of one asset's share book. Optimistic version guards
 * concurrent writers across router instances.
 */
@Entity
@Table(name = "share_book")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShareBookSnapshotEntity {

    @Id
    @Column(name = "asset", nullable = false, length = 255)
    private String asset;

    @Column(name = "snapshot_data", nullable = false, columnDefinition = "TEXT")
    private String snapshotData;

    @Column(name = "total_shares", nullable = false, precision = 78, scale = 0)
    private BigInteger totalShares;

    @Column(name = "active_count", nullable = false)
    private Integer activeCount;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
