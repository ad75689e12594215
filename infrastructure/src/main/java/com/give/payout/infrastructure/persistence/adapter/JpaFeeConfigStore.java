package com.give.payout.infrastructure.persistence.adapter;

import com.give.payout.domain.model.FeeConfig;
import com.give.payout.domain.store.FeeConfigStore;
import com.give.payout.infrastructure.persistence.entity.RouterSettingsEntity;
import com.give.payout.infrastructure.persistence.repository.RouterSettingsRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class JpaFeeConfigStore implements FeeConfigStore {

    private final RouterSettingsRepository settingsRepository;

    public JpaFeeConfigStore(RouterSettingsRepository settingsRepository) {
        this.settingsRepository = settingsRepository;
    }

    /**
     * Empty until the router has been initialized
     */
    @Override
    public Optional<FeeConfig> load() {
        RouterSettingsEntity settings = settingsRepository.findSettings();
        if (settings.getFeeRecipient() == null) {
            return Optional.empty();
        }
        return Optional.of(FeeConfig.builder()
                .feeRecipient(settings.getFeeRecipient())
                .feeBps(settings.getFeeBps())
                .maxFeeBps(settings.getMaxFeeBps())
                .protocolTreasury(settings.getProtocolTreasury())
                .protocolFeeBps(settings.getProtocolFeeBps())
                .build());
    }

    @Override
    public void save(FeeConfig feeConfig) {
        RouterSettingsEntity settings = settingsRepository.findSettings();
        settings.setFeeRecipient(feeConfig.getFeeRecipient());
        settings.setFeeBps(feeConfig.getFeeBps());
        settings.setMaxFeeBps(feeConfig.getMaxFeeBps());
        settings.setProtocolTreasury(feeConfig.getProtocolTreasury());
        settings.setProtocolFeeBps(feeConfig.getProtocolFeeBps());
        settingsRepository.save(settings);
    }
}
