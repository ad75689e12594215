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

/**
 * Single-row table holding router-wide settings and the global distribution counter
 */
@Entity
@Table(name = "router_settings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouterSettingsEntity {

    public static final long SETTINGS_ID = 1L;

    @Id
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "fee_recipient", length = 255)
    private String feeRecipient;

    @Column(name = "fee_bps")
    private Integer feeBps;

    @Column(name = "max_fee_bps")
    private Integer maxFeeBps;

    @Column(name = "protocol_treasury", length = 255)
    private String protocolTreasury;

    @Column(name = "protocol_fee_bps")
    private Integer protocolFeeBps;

    /**
     * Comma separated, empty until first configured
     */
    @Column(name = "accepted_splits", length = 512)
    private String acceptedSplits;

    @Column(name = "paused", nullable = false)
    private boolean paused;

    @Column(name = "total_distributions", nullable = false)
    private long totalDistributions;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public static RouterSettingsEntity empty() {
        return RouterSettingsEntity.builder()
                .id(SETTINGS_ID)
                .paused(false)
                .totalDistributions(0L)
                .build();
    }
}
