package com.give.payout.infrastructure.persistence.adapter;

import com.give.payout.domain.model.DistributionStats;
import com.give.payout.domain.store.DistributionStatsStore;
import com.give.payout.infrastructure.persistence.entity.DistributionStatsEntity;
import com.give.payout.infrastructure.persistence.entity.RouterSettingsEntity;
import com.give.payout.infrastructure.persistence.repository.DistributionStatsRepository;
import com.give.payout.infrastructure.persistence.repository.RouterSettingsRepository;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;

@Component
public class JpaDistributionStatsStore implements DistributionStatsStore {

    private final DistributionStatsRepository statsRepository;
    private final RouterSettingsRepository settingsRepository;

    public JpaDistributionStatsStore(DistributionStatsRepository statsRepository,
                                     RouterSettingsRepository settingsRepository) {
        this.statsRepository = statsRepository;
        this.settingsRepository = settingsRepository;
    }

    @Override
    public DistributionStats load(String asset) {
        return statsRepository.findById(asset)
                .map(entity -> DistributionStats.builder()
                        .asset(entity.getAsset())
                        .totalDonated(entity.getTotalDonated())
                        .totalFeeCollected(entity.getTotalFeeCollected())
                        .totalProtocolFees(entity.getTotalProtocolFees())
                        .lastDistributionAt(entity.getLastDistributionAt() != null
                                ? entity.getLastDistributionAt().toInstant() : null)
                        .build())
                .orElseGet(() -> DistributionStats.empty(asset));
    }

    @Override
    public void save(DistributionStats stats) {
        DistributionStatsEntity entity = statsRepository.findById(stats.getAsset())
                .orElseGet(() -> DistributionStatsEntity.builder().asset(stats.getAsset()).build());
        entity.setTotalDonated(stats.getTotalDonated());
        entity.setTotalFeeCollected(stats.getTotalFeeCollected());
        entity.setTotalProtocolFees(stats.getTotalProtocolFees());
        entity.setLastDistributionAt(stats.getLastDistributionAt() != null
                ? stats.getLastDistributionAt().atOffset(ZoneOffset.UTC) : null);
        statsRepository.save(entity);
    }

    @Override
    public long totalDistributions() {
        return settingsRepository.findSettings().getTotalDistributions();
    }

    @Override
    public void saveTotalDistributions(long totalDistributions) {
        RouterSettingsEntity settings = settingsRepository.findSettings();
        settings.setTotalDistributions(totalDistributions);
        settingsRepository.save(settings);
    }
}
