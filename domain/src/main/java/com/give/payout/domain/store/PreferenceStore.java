package com.give.payout.domain.store;

import com.give.payout.domain.model.AllocationPreference;

import java.util.Optional;
import java.util.Set;

public interface PreferenceStore {

    Optional<AllocationPreference> find(String stakeholder);

    void save(AllocationPreference preference);

    /**
     * @return accepted split percentages, empty when never configured
     */
    Set<Integer> loadAcceptedSplits();

    void saveAcceptedSplits(Set<Integer> acceptedSplits);
}
