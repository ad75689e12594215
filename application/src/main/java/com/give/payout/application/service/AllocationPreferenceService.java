package com.give.payout.application.service;

import com.give.payout.application.config.PayoutProperties;
import com.give.payout.application.guard.ExecutionGuard;
import com.give.payout.domain.auth.PayoutFunction;
import com.give.payout.domain.event.AuditEvent;
import com.give.payout.domain.event.AuditEventType;
import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import com.give.payout.domain.model.AllocationPreference;
import com.give.payout.domain.registry.BeneficiaryRegistry;
import com.give.payout.domain.store.PreferenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Stakeholder allocation preferences and the accepted split percentages
 */
@Service
public class AllocationPreferenceService {

    private static final Logger log = LoggerFactory.getLogger(AllocationPreferenceService.class);

    private final PreferenceStore preferenceStore;
    private final BeneficiaryRegistry beneficiaryRegistry;
    private final AccessControlService accessControlService;
    private final ExecutionGuard executionGuard;
    private final AuditTrail auditTrail;
    private final MetricsService metricsService;
    private final PayoutProperties properties;
    private final Clock clock;

    public AllocationPreferenceService(PreferenceStore preferenceStore,
                                       BeneficiaryRegistry beneficiaryRegistry,
                                       AccessControlService accessControlService,
                                       ExecutionGuard executionGuard,
                                       AuditTrail auditTrail,
                                       MetricsService metricsService,
                                       PayoutProperties properties,
                                       Clock clock) {
        this.preferenceStore = preferenceStore;
        this.beneficiaryRegistry = beneficiaryRegistry;
        this.accessControlService = accessControlService;
        this.executionGuard = executionGuard;
        this.auditTrail = auditTrail;
        this.metricsService = metricsService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Only the stakeholder itself may set its preference
     */
    public AllocationPreference setPreference(String caller, String stakeholder, String beneficiary, int splitPercent) {
        return executionGuard.execute("setPreference", () -> {
            PayoutValidation.requireAddress(stakeholder, "stakeholder");
            if (!stakeholder.equals(caller)) {
                throw new PayoutException(PayoutErrorCode.UNAUTHORIZED_CALLER,
                        "Caller " + caller + " cannot set the preference of " + stakeholder);
            }
            PayoutValidation.requireAddress(beneficiary, "beneficiary");
            Set<Integer> accepted = getAcceptedSplits();
            if (!accepted.contains(splitPercent)) {
                throw new PayoutException(PayoutErrorCode.INVALID_SPLIT_PERCENT,
                        "splitPercent " + splitPercent + " is not one of " + accepted);
            }
            if (!beneficiaryRegistry.isApproved(beneficiary)) {
                throw new PayoutException(PayoutErrorCode.UNAPPROVED_BENEFICIARY,
                        "Beneficiary " + beneficiary + " is not approved");
            }

            AllocationPreference previous = getPreference(stakeholder);
            AllocationPreference preference = AllocationPreference.builder()
                    .stakeholder(stakeholder)
                    .beneficiary(beneficiary)
                    .splitPercent(splitPercent)
                    .lastUpdated(clock.instant())
                    .build();
            preferenceStore.save(preference);

            auditTrail.record(AuditEvent.builder()
                    .type(AuditEventType.PREFERENCE_CHANGED)
                    .actor(caller)
                    .stakeholder(stakeholder)
                    .recipient(beneficiary)
                    .oldValue(describe(previous))
                    .newValue(describe(preference))
                    .build());
            metricsService.recordPreferenceUpdate();
            log.info("Preference set for {}: {}% to {}", stakeholder, splitPercent, beneficiary);
            return preference;
        });
    }

    public AllocationPreference getPreference(String stakeholder) {
        return preferenceStore.find(stakeholder).orElseGet(() -> AllocationPreference.unset(stakeholder));
    }

    public Set<Integer> getAcceptedSplits() {
        Set<Integer> stored = preferenceStore.loadAcceptedSplits();
        if (stored.isEmpty()) {
            return Collections.unmodifiableSet(new TreeSet<>(properties.getAcceptedSplits()));
        }
        return Collections.unmodifiableSet(new TreeSet<>(stored));
    }

    public Set<Integer> updateAcceptedSplits(String caller, Collection<Integer> splits) {
        return executionGuard.executeAdministrative("updateAcceptedSplits", () -> {
            accessControlService.requireEntitlement(caller, PayoutFunction.ACCEPTED_SPLITS_UPDATE);
            Set<Integer> updated = validateSplits(splits);
            Set<Integer> previous = getAcceptedSplits();

            preferenceStore.saveAcceptedSplits(updated);
            auditTrail.record(AuditEvent.builder()
                    .type(AuditEventType.ACCEPTED_SPLITS_CHANGED)
                    .actor(caller)
                    .oldValue(previous.toString())
                    .newValue(updated.toString())
                    .build());
            log.info("Accepted splits changed by {}: {} -> {}", caller, previous, updated);
            return Collections.unmodifiableSet(updated);
        });
    }

    /**
     * Store the configured default split set on first start
     */
    public void initializeIfAbsent() {
        executionGuard.executeAdministrative("initializeAcceptedSplits", () -> {
            if (preferenceStore.loadAcceptedSplits().isEmpty()) {
                Set<Integer> defaults = validateSplits(properties.getAcceptedSplits());
                preferenceStore.saveAcceptedSplits(defaults);
                log.info("Initialized accepted splits {}", defaults);
            }
            return null;
        });
    }

    private static Set<Integer> validateSplits(Collection<Integer> splits) {
        if (splits == null || splits.isEmpty()) {
            throw new PayoutException(PayoutErrorCode.INVALID_SPLIT_PERCENT, "Accepted splits must not be empty");
        }
        Set<Integer> result = new TreeSet<>();
        for (Integer split : splits) {
            if (split == null || split < 1 || split > FeeCalculator.PERCENT_DENOMINATOR) {
                throw new PayoutException(PayoutErrorCode.INVALID_SPLIT_PERCENT, "Split " + split + " outside [1, 100]");
            }
            result.add(split);
        }
        return result;
    }

    private static String describe(AllocationPreference preference) {
        return preference.isSet() ? preference.getBeneficiary() + ":" + preference.getSplitPercent() : null;
    }
}
