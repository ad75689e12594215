package com.give.payout.infrastructure.persistence.adapter;

import com.give.payout.domain.model.AllocationPreference;
import com.give.payout.domain.store.PreferenceStore;
import com.give.payout.infrastructure.persistence.entity.AllocationPreferenceEntity;
import com.give.payout.infrastructure.persistence.entity.RouterSettingsEntity;
import com.give.payout.infrastructure.persistence.repository.AllocationPreferenceRepository;
import com.give.payout.infrastructure.persistence.repository.RouterSettingsRepository;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Component
public class JpaPreferenceStore implements PreferenceStore {

    private final AllocationPreferenceRepository preferenceRepository;
    private final RouterSettingsRepository settingsRepository;

    public JpaPreferenceStore(AllocationPreferenceRepository preferenceRepository,
                              RouterSettingsRepository settingsRepository) {
        this.preferenceRepository = preferenceRepository;
        this.settingsRepository = settingsRepository;
    }

    @Override
    public Optional<AllocationPreference> find(String stakeholder) {
        return preferenceRepository.findById(stakeholder)
                .map(entity -> AllocationPreference.builder()
                        .stakeholder(entity.getStakeholder())
                        .beneficiary(entity.getBeneficiary())
                        .splitPercent(entity.getSplitPercent())
                        .lastUpdated(entity.getLastUpdated().toInstant())
                        .build());
    }

    @Override
    public void save(AllocationPreference preference) {
        preferenceRepository.save(AllocationPreferenceEntity.builder()
                .stakeholder(preference.getStakeholder())
                .beneficiary(preference.getBeneficiary())
                .splitPercent(preference.getSplitPercent())
                .lastUpdated(preference.getLastUpdated().atOffset(ZoneOffset.UTC))
                .build());
    }

    @Override
    public Set<Integer> loadAcceptedSplits() {
        String csv = settingsRepository.findSettings().getAcceptedSplits();
        if (csv == null || csv.isBlank()) {
            return new TreeSet<>();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Integer::valueOf)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public void saveAcceptedSplits(Set<Integer> acceptedSplits) {
        RouterSettingsEntity settings = settingsRepository.findSettings();
        settings.setAcceptedSplits(new TreeSet<>(acceptedSplits).stream()
                .map(String::valueOf)
                .collect(Collectors.joining(",")));
        settingsRepository.save(settings);
    }
}
