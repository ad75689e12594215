package com.give.payout.domain.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Message published by the custody vault
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VaultEvent {
    private String eventId;
    private VaultEventType type;
    private String callerId;     // vault identity, must be an authorized caller
    private String asset;
    private String stakeholder;  // SHARE_CHANGE only
    private BigInteger newShareAmount;
    private BigInteger yieldAmount;
    private Instant emittedAt;
}
