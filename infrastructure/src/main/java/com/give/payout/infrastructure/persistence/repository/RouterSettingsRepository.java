package com.give.payout.infrastructure.persistence.repository;

import com.give.payout.infrastructure.persistence.entity.RouterSettingsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RouterSettingsRepository extends JpaRepository<RouterSettingsEntity, Long> {

    /**
     * The settings row, created on first access if the migration did not seed it
     */
    default RouterSettingsEntity findSettings() {
        return findById(RouterSettingsEntity.SETTINGS_ID)
                .orElseGet(() -> save(RouterSettingsEntity.empty()));
    }
}
