package com.give.payout.domain.model;

/**
 * Effect of a share write on the active stakeholder index
 */
public enum MembershipChange {
    JOINED,     // 0 -> nonzero, appended to the index
    LEFT,       // nonzero -> 0, swap-popped out of the index
    UNCHANGED
}
