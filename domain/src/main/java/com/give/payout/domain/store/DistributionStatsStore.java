package com.give.payout.domain.store;

import com.give.payout.domain.model.DistributionStats;

public interface DistributionStatsStore {

    /**
     * @return stored counters, or zeroed counters for an asset never distributed
     */
    DistributionStats load(String asset);

    void save(DistributionStats stats);

    long totalDistributions();

    void saveTotalDistributions(long totalDistributions);
}
