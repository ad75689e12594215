package com.give.payout.application.service;

import com.give.payout.domain.event.VaultEvent;
import com.give.payout.domain.model.UInt256;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks on inbound vault events before they reach the ledger
 */
@Service
public class VaultEventValidationService {

    private static final Logger log = LoggerFactory.getLogger(VaultEventValidationService.class);

    /**
     * @return empty list if valid, otherwise one message per problem
     */
    public List<String> validate(VaultEvent event) {
        List<String> errors = new ArrayList<>();

        if (isBlank(event.getEventId())) {
            errors.add("Event ID is required");
        }
        if (isBlank(event.getCallerId())) {
            errors.add("Caller ID is required");
        }
        if (isBlank(event.getAsset())) {
            errors.add("Asset is required");
        }

        if (event.getType() == null) {
            errors.add("Event type is required");
        } else {
            switch (event.getType()) {
                case SHARE_CHANGE:
                    if (isBlank(event.getStakeholder())) {
                        errors.add("Stakeholder is required for SHARE_CHANGE");
                    }
                    if (event.getNewShareAmount() == null) {
                        errors.add("New share amount is required for SHARE_CHANGE");
                    } else if (!UInt256.isInRange(event.getNewShareAmount())) {
                        errors.add("New share amount must be within [0, 2^256 - 1]");
                    }
                    break;
                case DEPOSIT:
                case HARVEST:
                    if (event.getYieldAmount() == null) {
                        errors.add("Yield amount is required for " + event.getType());
                    } else if (event.getYieldAmount().signum() <= 0 || !UInt256.isInRange(event.getYieldAmount())) {
                        errors.add("Yield amount must be positive and within uint256");
                    }
                    break;
                default:
                    errors.add("Unsupported event type " + event.getType());
            }
        }

        if (!errors.isEmpty()) {
            log.warn("Validation failed for vault event {}: {}", event.getEventId(), errors);
        }
        return errors;
    }

    public boolean isValid(VaultEvent event) {
        return validate(event).isEmpty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
