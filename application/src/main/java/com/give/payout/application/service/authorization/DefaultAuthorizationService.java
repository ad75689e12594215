package com.give.payout.application.service.authorization;

import com.give.payout.application.config.PayoutProperties;
import com.give.payout.domain.auth.AuthorizationService;
import com.give.payout.domain.auth.PayoutFunction;
import com.give.payout.domain.auth.PayoutRole;
import com.give.payout.domain.auth.UserContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Role grants read from {@code app.payout.roles}. Each role is held by an
 * explicit list of user ids; nobody holds a role implicitly.
 */
@Service
public class DefaultAuthorizationService implements AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(DefaultAuthorizationService.class);

    private final Map<PayoutRole, List<String>> grants;

    public DefaultAuthorizationService(PayoutProperties properties) {
        this.grants = properties.getRoles();
        grants.forEach((role, users) -> log.info("Role {} granted to {} user(s)", role, users.size()));
    }

    @Override
    public boolean hasEntitlement(String userId, PayoutFunction function) {
        if (userId == null || function == null) {
            log.warn("hasEntitlement called with null userId or function");
            return false;
        }
        boolean entitled = hasRole(userId, function.getRequiredRole());
        log.debug("Entitlement check: userId={}, function={}, granted={}", userId, function.getFunctionName(), entitled);
        return entitled;
    }

    @Override
    public boolean hasRole(String userId, PayoutRole role) {
        if (userId == null || role == null) {
            return false;
        }
        return grants.getOrDefault(role, Collections.emptyList()).contains(userId);
    }

    @Override
    public List<PayoutRole> getUserRoles(String userId) {
        List<PayoutRole> roles = new ArrayList<>();
        for (PayoutRole role : PayoutRole.values()) {
            if (hasRole(userId, role)) {
                roles.add(role);
            }
        }
        return roles;
    }

    @Override
    public UserContext getUserContext(String userId) {
        return UserContext.builder()
                .userId(userId)
                .roles(getUserRoles(userId))
                .build();
    }
}
