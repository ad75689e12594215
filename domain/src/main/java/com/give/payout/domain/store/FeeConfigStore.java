package com.give.payout.domain.store;

import com.give.payout.domain.model.FeeConfig;

import java.util.Optional;

public interface FeeConfigStore {

    Optional<FeeConfig> load();

    void save(FeeConfig feeConfig);
}
