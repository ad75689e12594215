package com.give.payout.application.service;

import com.give.payout.application.guard.ExecutionGuard;
import com.give.payout.domain.auth.AuthorizationService;
import com.give.payout.domain.auth.PayoutFunction;
import com.give.payout.domain.event.AuditEvent;
import com.give.payout.domain.event.AuditEventType;
import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import com.give.payout.domain.store.AccessControlStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.TreeSet;

/**
 * Authorized-caller set, role checks and the global pause switch
 */
@Service
public class AccessControlService {

    private static final Logger log = LoggerFactory.getLogger(AccessControlService.class);

    private final AccessControlStore accessControlStore;
    private final AuthorizationService authorizationService;
    private final ExecutionGuard executionGuard;
    private final AuditTrail auditTrail;

    public AccessControlService(AccessControlStore accessControlStore,
                                AuthorizationService authorizationService,
                                ExecutionGuard executionGuard,
                                AuditTrail auditTrail) {
        this.accessControlStore = accessControlStore;
        this.authorizationService = authorizationService;
        this.executionGuard = executionGuard;
        this.auditTrail = auditTrail;
    }

    /**
     * Gate for share updates and distribution triggers
     */
    public void requireAuthorizedCaller(String caller) {
        if (caller == null || caller.isBlank() || !accessControlStore.isAuthorizedCaller(caller)) {
            throw new PayoutException(PayoutErrorCode.UNAUTHORIZED_CALLER, "Caller " + caller + " is not authorized");
        }
    }

    public void requireEntitlement(String caller, PayoutFunction function) {
        if (caller == null || !authorizationService.hasEntitlement(caller, function)) {
            throw new PayoutException(PayoutErrorCode.MISSING_ROLE,
                    "Caller " + caller + " lacks role " + function.getRequiredRole() + " for " + function.getFunctionName());
        }
    }

    public boolean isAuthorizedCaller(String target) {
        return target != null && accessControlStore.isAuthorizedCaller(target);
    }

    public Set<String> getAuthorizedCallers() {
        return new TreeSet<>(accessControlStore.authorizedCallers());
    }

    public boolean isPaused() {
        return accessControlStore.isPaused();
    }

    public void setAuthorizedCaller(String caller, String target, boolean allowed) {
        executionGuard.executeAdministrative("setAuthorizedCaller", () -> {
            requireEntitlement(caller, PayoutFunction.CALLER_ADMIN);
            PayoutValidation.requireAddress(target, "target");

            boolean previous = accessControlStore.isAuthorizedCaller(target);
            accessControlStore.setAuthorizedCaller(target, allowed);
            auditTrail.record(AuditEvent.builder()
                    .type(AuditEventType.AUTHORIZED_CALLER_CHANGED)
                    .actor(caller)
                    .recipient(target)
                    .oldValue(String.valueOf(previous))
                    .newValue(String.valueOf(allowed))
                    .build());
            log.info("Authorized caller {} set to {} by {}", target, allowed, caller);
            return null;
        });
    }

    public void pause(String caller) {
        changePause(caller, true, PayoutFunction.SYSTEM_PAUSE);
    }

    public void unpause(String caller) {
        changePause(caller, false, PayoutFunction.SYSTEM_UNPAUSE);
    }

    /**
     * Seeds callers from configuration without an actor; used at startup only
     */
    public void seedAuthorizedCallers(Iterable<String> callers) {
        executionGuard.executeAdministrative("seedAuthorizedCallers", () -> {
            for (String caller : callers) {
                if (caller != null && !caller.isBlank() && !accessControlStore.isAuthorizedCaller(caller)) {
                    accessControlStore.setAuthorizedCaller(caller, true);
                    log.info("Seeded authorized caller {}", caller);
                }
            }
            return null;
        });
    }

    private void changePause(String caller, boolean paused, PayoutFunction function) {
        executionGuard.executeAdministrative(function.getFunctionName(), () -> {
            requireEntitlement(caller, function);
            boolean current = accessControlStore.isPaused();
            if (current == paused) {
                throw new PayoutException(paused ? PayoutErrorCode.ALREADY_PAUSED : PayoutErrorCode.NOT_PAUSED,
                        paused ? "Router is already paused" : "Router is not paused");
            }

            accessControlStore.setPaused(paused);
            auditTrail.record(AuditEvent.builder()
                    .type(AuditEventType.PAUSE_CHANGED)
                    .actor(caller)
                    .oldValue(String.valueOf(current))
                    .newValue(String.valueOf(paused))
                    .build());
            log.warn("Router {} by {}", paused ? "PAUSED" : "UNPAUSED", caller);
            return null;
        });
    }
}
