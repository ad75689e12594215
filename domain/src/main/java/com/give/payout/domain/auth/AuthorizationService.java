package com.give.payout.domain.auth;

import java.util.List;

/**
 * Resolves administrative roles for callers
 */
public interface AuthorizationService {

    /**
     * Check if user holds the role required by a function
     */
    boolean hasEntitlement(String userId, PayoutFunction function);

    boolean hasRole(String userId, PayoutRole role);

    List<PayoutRole> getUserRoles(String userId);

    UserContext getUserContext(String userId);
}
