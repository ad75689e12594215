package com.give.payout.api.filter;

import com.give.payout.api.service.UserContextExtractor;
import com.give.payout.domain.auth.AuthorizationService;
import com.give.payout.domain.auth.PayoutFunction;
import com.give.payout.domain.auth.UserContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rejects requests without a caller identity and short-circuits admin calls
 * from users lacking the required role. Services re-check entitlements.
 */
@Component
@Order(2)
public class AuthorizationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationFilter.class);

    // "METHOD path" -> function, first match wins
    private static final Map<Pattern, PayoutFunction> URL_FUNCTION_MAP = new LinkedHashMap<>();

    static {
        URL_FUNCTION_MAP.put(Pattern.compile("PUT /api/admin/fee-config"), PayoutFunction.FEE_CONFIG_UPDATE);
        URL_FUNCTION_MAP.put(Pattern.compile("PUT /api/admin/treasury"), PayoutFunction.TREASURY_UPDATE);
        URL_FUNCTION_MAP.put(Pattern.compile("PUT /api/admin/accepted-splits"), PayoutFunction.ACCEPTED_SPLITS_UPDATE);
        URL_FUNCTION_MAP.put(Pattern.compile("PUT /api/admin/authorized-callers/.+"), PayoutFunction.CALLER_ADMIN);
        URL_FUNCTION_MAP.put(Pattern.compile("POST /api/admin/pause"), PayoutFunction.SYSTEM_PAUSE);
        URL_FUNCTION_MAP.put(Pattern.compile("POST /api/admin/unpause"), PayoutFunction.SYSTEM_UNPAUSE);
        URL_FUNCTION_MAP.put(Pattern.compile("POST /api/admin/custody/.+/emergency-withdrawals"), PayoutFunction.EMERGENCY_WITHDRAW);
    }

    private final AuthorizationService authorizationService;
    private final UserContextExtractor userContextExtractor;

    @Value("${app.authorization.enabled:true}")
    private boolean authorizationEnabled = true;

    public AuthorizationFilter(AuthorizationService authorizationService,
                               UserContextExtractor userContextExtractor) {
        this.authorizationService = authorizationService;
        this.userContextExtractor = userContextExtractor;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String path = request.getRequestURI();
        if (!authorizationEnabled || isPublicEndpoint(path)) {
            filterChain.doFilter(request, response);
            return;
        }

        UserContext userContext = userContextExtractor.extract(request);
        if (userContext == null || userContext.getUserId() == null) {
            log.warn("No caller identity on {} {}, denying access", request.getMethod(), path);
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED, "UNAUTHENTICATED", "Caller identity required");
            return;
        }

        PayoutFunction requiredFunction = determineRequiredFunction(request.getMethod(), path);
        if (requiredFunction != null
                && !authorizationService.hasEntitlement(userContext.getUserId(), requiredFunction)) {
            log.warn("User {} denied access to {} (required function: {})",
                    userContext.getUserId(), path, requiredFunction.getFunctionName());
            writeError(response, HttpServletResponse.SC_FORBIDDEN, "MISSING_ROLE",
                    "Caller lacks role " + requiredFunction.getRequiredRole());
            return;
        }

        request.setAttribute(UserContextExtractor.USER_CONTEXT_ATTRIBUTE, userContext);
        filterChain.doFilter(request, response);
    }

    void setAuthorizationEnabled(boolean authorizationEnabled) {
        this.authorizationEnabled = authorizationEnabled;
    }

    private boolean isPublicEndpoint(String path) {
        return !path.startsWith("/api/");
    }

    static PayoutFunction determineRequiredFunction(String method, String path) {
        String methodPath = method + " " + path;
        for (Map.Entry<Pattern, PayoutFunction> entry : URL_FUNCTION_MAP.entrySet()) {
            if (entry.getKey().matcher(methodPath).matches()) {
                return entry.getValue();
            }
        }
        return null;
    }

    private void writeError(HttpServletResponse response, int status, String code, String message) throws IOException {
        response.setStatus(status);
        response.setContentType("application/json");
        response.getWriter().write(String.format("{\"errorCode\":\"%s\",\"message\":\"%s\"}", code, message));
    }
}
