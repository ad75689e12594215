package com.give.payout.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.OffsetDateTime;

/**
 * Balance of one holder in one asset
 */
@Entity
@Table(name = "custody_balance")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustodyBalanceEntity {

    @EmbeddedId
    private CustodyBalanceId id;

    @Column(name = "balance", nullable = false, precision = 78, scale = 0)
    private BigInteger balance;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
