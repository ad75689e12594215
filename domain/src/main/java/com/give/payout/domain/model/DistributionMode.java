package com.give.payout.domain.model;

public enum DistributionMode {
    SINGLE,        // one default beneficiary from the registry
    EQUAL_SPLIT,   // explicit beneficiary list, equal parts
    PROPORTIONAL   // per-stakeholder split driven by the share ledger
}
