package com.give.payout.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A stakeholder's split between its chosen beneficiary and the fallback treasury
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllocationPreference {
    private String stakeholder;
    private String beneficiary;
    private int splitPercent;     // share of net yield sent to the beneficiary
    private Instant lastUpdated;

    /**
     * Sentinel returned for stakeholders that never set a preference
     */
    public static AllocationPreference unset(String stakeholder) {
        return AllocationPreference.builder()
                .stakeholder(stakeholder)
                .splitPercent(0)
                .build();
    }

    public boolean isSet() {
        return beneficiary != null && !beneficiary.isBlank() && splitPercent > 0;
    }
}
