package com.give.payout.application.config;

import com.give.payout.application.service.AccessControlService;
import com.give.payout.application.service.AllocationPreferenceService;
import com.give.payout.application.service.FeeConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Persists the configured defaults the first time the router starts.
 * Existing stored values always win over configuration.
 */
@Component
public class RouterBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(RouterBootstrap.class);

    private final FeeConfigService feeConfigService;
    private final AllocationPreferenceService allocationPreferenceService;
    private final AccessControlService accessControlService;
    private final PayoutProperties properties;

    public RouterBootstrap(FeeConfigService feeConfigService,
                           AllocationPreferenceService allocationPreferenceService,
                           AccessControlService accessControlService,
                           PayoutProperties properties) {
        this.feeConfigService = feeConfigService;
        this.allocationPreferenceService = allocationPreferenceService;
        this.accessControlService = accessControlService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        feeConfigService.initializeIfAbsent();
        allocationPreferenceService.initializeIfAbsent();
        accessControlService.seedAuthorizedCallers(properties.getAuthorizedCallers());
        log.info("Payout router ready: custody account {}, paused={}", properties.getCustodyAccount(), accessControlService.isPaused());
    }
}
