package com.give.payout.domain.auth;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * Identity of the party invoking an operation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserContext {
    private String userId;
    @Builder.Default
    private List<PayoutRole> roles = Collections.emptyList();
    private String sessionId;
    private String clientIp;

    public boolean hasRole(PayoutRole role) {
        return roles != null && roles.contains(role);
    }
}
