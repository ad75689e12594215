package com.give.payout.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Entity
@Table(name = "allocation_preference", indexes = {
    @Index(name = "idx_allocation_preference_beneficiary", columnList = "beneficiary")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllocationPreferenceEntity {

    @Id
    @Column(name = "stakeholder", nullable = false, length = 255)
    private String stakeholder;

    @Column(name = "beneficiary", nullable = false, length = 255)
    private String beneficiary;

    @Column(name = "split_percent", nullable = false)
    private Integer splitPercent;

    @Column(name = "last_updated", nullable = false)
    private OffsetDateTime lastUpdated;
}
