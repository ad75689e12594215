package com.give.payout.infrastructure.registry;

import com.give.payout.domain.registry.BeneficiaryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry defined in configuration, for local runs without the registry service.
 * Receipts are only kept in memory.
 *
 * Configuration:
 * - app.registry.type: "static"
 * - app.registry.approved: list of approved beneficiaries
 * - app.registry.default-beneficiary: beneficiary for single distributions
 */
@Component
@ConditionalOnProperty(name = "app.registry.type", havingValue = "static")
public class ConfiguredBeneficiaryRegistry implements BeneficiaryRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredBeneficiaryRegistry.class);

    private final Set<String> approved;
    private final String defaultBeneficiary;
    private final Map<String, BigInteger> receipts = new ConcurrentHashMap<>();

    public ConfiguredBeneficiaryRegistry(@Value("${app.registry.approved:}") List<String> approved,
                                         @Value("${app.registry.default-beneficiary:}") String defaultBeneficiary) {
        this.approved = Set.copyOf(approved);
        this.defaultBeneficiary = defaultBeneficiary;
        log.info("Using configured beneficiary registry: {} approved, default {}", approved.size(), defaultBeneficiary);
    }

    @Override
    public boolean isApproved(String beneficiary) {
        return beneficiary != null && approved.contains(beneficiary);
    }

    @Override
    public Optional<String> currentBeneficiary() {
        return Optional.ofNullable(defaultBeneficiary).filter(b -> !b.isBlank());
    }

    @Override
    public void recordReceipt(String beneficiary, BigInteger amount) {
        receipts.merge(beneficiary, amount, BigInteger::add);
    }

    public BigInteger totalReceived(String beneficiary) {
        return receipts.getOrDefault(beneficiary, BigInteger.ZERO);
    }
}
