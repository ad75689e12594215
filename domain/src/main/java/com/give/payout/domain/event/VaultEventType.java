package com.give.payout.domain.event;

public enum VaultEventType {
    SHARE_CHANGE,   // a stakeholder's vault balance changed
    DEPOSIT,        // assets moved into router custody
    HARVEST         // yield in custody should be distributed
}
