package com.give.payout.domain.auth;

/**
 * Administrative functions and the role each one requires
 */
public enum PayoutFunction {
    FEE_CONFIG_UPDATE("fee:update", "Change fee recipient and fee rate", PayoutRole.FEE_ADMIN),
    TREASURY_UPDATE("treasury:update", "Change protocol treasury", PayoutRole.FEE_ADMIN),
    ACCEPTED_SPLITS_UPDATE("splits:update", "Change accepted split percentages", PayoutRole.FEE_ADMIN),
    CALLER_ADMIN("caller:admin", "Grant or revoke authorized callers", PayoutRole.CALLER_ADMIN),
    SYSTEM_PAUSE("system:pause", "Pause mutating entry points", PayoutRole.EMERGENCY_ADMIN),
    SYSTEM_UNPAUSE("system:unpause", "Resume mutating entry points", PayoutRole.EMERGENCY_ADMIN),
    EMERGENCY_WITHDRAW("custody:emergency-withdraw", "Move stranded custody balances", PayoutRole.EMERGENCY_ADMIN);

    private final String functionName;
    private final String description;
    private final PayoutRole requiredRole;

    PayoutFunction(String functionName, String description, PayoutRole requiredRole) {
        this.functionName = functionName;
        this.description = description;
        this.requiredRole = requiredRole;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getDescription() {
        return description;
    }

    public PayoutRole getRequiredRole() {
        return requiredRole;
    }

    public static PayoutFunction fromFunctionName(String functionName) {
        for (PayoutFunction func : values()) {
            if (func.functionName.equals(functionName)) {
                return func;
            }
        }
        return null;
    }
}
