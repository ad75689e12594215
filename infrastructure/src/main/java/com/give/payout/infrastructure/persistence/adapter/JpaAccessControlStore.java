package com.give.payout.infrastructure.persistence.adapter;

import com.give.payout.domain.store.AccessControlStore;
import com.give.payout.infrastructure.persistence.entity.AuthorizedCallerEntity;
import com.give.payout.infrastructure.persistence.entity.RouterSettingsEntity;
import com.give.payout.infrastructure.persistence.repository.AuthorizedCallerRepository;
import com.give.payout.infrastructure.persistence.repository.RouterSettingsRepository;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class JpaAccessControlStore implements AccessControlStore {

    private final AuthorizedCallerRepository callerRepository;
    private final RouterSettingsRepository settingsRepository;
    private final Clock clock;

    public JpaAccessControlStore(AuthorizedCallerRepository callerRepository,
                                 RouterSettingsRepository settingsRepository,
                                 Clock clock) {
        this.callerRepository = callerRepository;
        this.settingsRepository = settingsRepository;
        this.clock = clock;
    }

    @Override
    public boolean isAuthorizedCaller(String caller) {
        return callerRepository.existsById(caller);
    }

    @Override
    public void setAuthorizedCaller(String caller, boolean authorized) {
        if (authorized) {
            if (!callerRepository.existsById(caller)) {
                callerRepository.save(new AuthorizedCallerEntity(caller, OffsetDateTime.now(clock)));
            }
        } else {
            callerRepository.deleteById(caller);
        }
    }

    @Override
    public Set<String> authorizedCallers() {
        return callerRepository.findAll().stream()
                .map(AuthorizedCallerEntity::getCallerId)
                .collect(Collectors.toSet());
    }

    @Override
    public boolean isPaused() {
        return settingsRepository.findSettings().isPaused();
    }

    @Override
    public void setPaused(boolean paused) {
        RouterSettingsEntity settings = settingsRepository.findSettings();
        settings.setPaused(paused);
        settingsRepository.save(settings);
    }
}
