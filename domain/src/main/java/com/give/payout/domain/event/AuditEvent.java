package com.give.payout.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.give.payout.domain.model.DistributionMode;
import com.give.payout.domain.model.RecipientKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Durable record of a state transition.
 * Only the fields relevant to {@link #type} are populated.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditEvent {
    private String eventId;
    private AuditEventType type;
    private Instant occurredAt;
    private String actor;
    private String correlationId;

    private String asset;
    private String stakeholder;
    private String recipient;
    private RecipientKind recipientKind;
    private DistributionMode mode;

    private BigInteger amount;
    private BigInteger fee;
    private BigInteger protocolAmount;
    private BigInteger beneficiaryAmount;
    private BigInteger treasuryAmount;
    private BigInteger totalShares;
    private Long distributionNumber;

    private String oldValue;
    private String newValue;

    /**
     * Partition key keeping events for one asset (or one subject) in order
     */
    public String partitionKey() {
        if (asset != null) {
            return asset;
        }
        return stakeholder != null ? stakeholder : recipient;
    }
}
