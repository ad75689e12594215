package com.give.payout.application.config;

import com.give.payout.domain.auth.PayoutRole;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Router settings bound from {@code app.payout.*}.
 * Fee and protocol values seed the persisted configuration on first start only.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "app.payout")
public class PayoutProperties {

    /**
     * Holder id of the router's own custody account
     */
    private String custodyAccount = "payout-router";

    private Fee fee = new Fee();
    private Protocol protocol = new Protocol();
    private Guard guard = new Guard();

    private List<Integer> acceptedSplits = new ArrayList<>(List.of(50, 75, 100));

    private List<String> authorizedCallers = new ArrayList<>();

    /**
     * Role -> user ids holding it
     */
    private Map<PayoutRole, List<String>> roles = new EnumMap<>(PayoutRole.class);

    @Getter
    @Setter
    public static class Fee {
        private String recipient;
        private int bps = 100;
        private int maxBps = 1_000;
    }

    @Getter
    @Setter
    public static class Protocol {
        private String treasury;
        private int feeBps = 250;
    }

    @Getter
    @Setter
    public static class Guard {
        private Duration lockTimeout = Duration.ofSeconds(5);
    }
}
