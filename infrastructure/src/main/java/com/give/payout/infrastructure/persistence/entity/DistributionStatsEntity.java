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

@Entity
@Table(name = "distribution_stats")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistributionStatsEntity {

    @Id
    @Column(name = "asset", nullable = false, length = 255)
    private String asset;

    @Column(name = "total_donated", nullable = false, precision = 78, scale = 0)
    private BigInteger totalDonated;

    @Column(name = "total_fee_collected", nullable = false, precision = 78, scale = 0)
    private BigInteger totalFeeCollected;

    @Column(name = "total_protocol_fees", nullable = false, precision = 78, scale = 0)
    private BigInteger totalProtocolFees;

    @Column(name = "last_distribution_at")
    private OffsetDateTime lastDistributionAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;
}
