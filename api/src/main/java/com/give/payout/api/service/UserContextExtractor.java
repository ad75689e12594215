package com.give.payout.api.service;

import com.give.payout.domain.auth.AuthorizationService;
import com.give.payout.domain.auth.UserContext;
import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import org.springframework.stereotype.Component;

/**
 * Resolves the calling identity from request headers.
 * Upstream gateways authenticate the caller and forward its id in {@code X-User-Id}.
 */
@Component
public class UserContextExtractor {

    public static final String USER_CONTEXT_ATTRIBUTE = "userContext";
    public static final String USER_ID_HEADER = "X-User-Id";

    private final AuthorizationService authorizationService;

    public UserContextExtractor(AuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    /**
     * @return the caller's context, or null when the request carries no identity
     */
    public UserContext extract(HttpServletRequest request) {
        String userId = request.getHeader(USER_ID_HEADER);
        if (userId == null || userId.isBlank()) {
            userId = request.getHeader("user-id");
        }
        if (userId == null || userId.isBlank()) {
            return null;
        }

        UserContext context = authorizationService.getUserContext(userId.trim());
        context.setClientIp(getClientIp(request));
        HttpSession session = request.getSession(false);
        context.setSessionId(session != null ? session.getId() : null);
        return context;
    }

    /**
     * Caller id for a service call; prefers the context stored by the filter
     */
    public String requireCallerId(HttpServletRequest request) {
        Object stored = request.getAttribute(USER_CONTEXT_ATTRIBUTE);
        UserContext context = stored instanceof UserContext ? (UserContext) stored : extract(request);
        if (context == null || context.getUserId() == null) {
            throw new PayoutException(PayoutErrorCode.UNAUTHORIZED_CALLER, "Request carries no caller identity");
        }
        return context.getUserId();
    }

    private String getClientIp(HttpServletRequest request) {
        String ip = request.getHeader("X-Forwarded-For");
        if (ip == null || ip.isEmpty() || "unknown".equalsIgnoreCase(ip)) {
            ip = request.getHeader("X-Real-IP");
        }
        if (ip == null || ip.isEmpty() || "unknown".equalsIgnoreCase(ip)) {
            ip = request.getRemoteAddr();
        }
        return ip;
    }
}
