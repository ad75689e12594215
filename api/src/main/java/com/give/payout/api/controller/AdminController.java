package com.give.payout.api.controller;

import com.give.payout.api.dto.AcceptedSplitsRequest;
import com.give.payout.api.dto.AuthorizedCallerRequest;
import com.give.payout.api.dto.BalanceResponse;
import com.give.payout.api.dto.EmergencyWithdrawRequest;
import com.give.payout.api.dto.FeeConfigRequest;
import com.give.payout.api.dto.RouterStatusResponse;
import com.give.payout.api.dto.TreasuryRequest;
import com.give.payout.api.service.UserContextExtractor;
import com.give.payout.application.service.AccessControlService;
import com.give.payout.application.service.AllocationPreferenceService;
import com.give.payout.application.service.CustodyService;
import com.give.payout.application.service.FeeConfigService;
import com.give.payout.domain.model.FeeConfig;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Set;

/**
 * Role-gated configuration, pause control and emergency custody access
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final FeeConfigService feeConfigService;
    private final AllocationPreferenceService preferenceService;
    private final AccessControlService accessControlService;
    private final CustodyService custodyService;
    private final UserContextExtractor userContextExtractor;

    public AdminController(FeeConfigService feeConfigService,
                           AllocationPreferenceService preferenceService,
                           AccessControlService accessControlService,
                           CustodyService custodyService,
                           UserContextExtractor userContextExtractor) {
        this.feeConfigService = feeConfigService;
        this.preferenceService = preferenceService;
        this.accessControlService = accessControlService;
        this.custodyService = custodyService;
        this.userContextExtractor = userContextExtractor;
    }

    @GetMapping("/fee-config")
    public ResponseEntity<FeeConfig> getFeeConfig() {
        return ResponseEntity.ok(feeConfigService.getFeeConfig());
    }

    @PutMapping("/fee-config")
    public ResponseEntity<FeeConfig> updateFeeConfig(@RequestBody FeeConfigRequest body, HttpServletRequest request) {
        String caller = userContextExtractor.requireCallerId(request);
        return ResponseEntity.ok(feeConfigService.updateFeeConfig(caller, body.getRecipient(), body.getFeeBps()));
    }

    @PutMapping("/treasury")
    public ResponseEntity<FeeConfig> setTreasury(@RequestBody TreasuryRequest body, HttpServletRequest request) {
        String caller = userContextExtractor.requireCallerId(request);
        return ResponseEntity.ok(feeConfigService.setTreasury(caller, body.getTreasury()));
    }

    @PutMapping("/accepted-splits")
    public ResponseEntity<Set<Integer>> updateAcceptedSplits(@RequestBody AcceptedSplitsRequest body,
                                                             HttpServletRequest request) {
        String caller = userContextExtractor.requireCallerId(request);
        return ResponseEntity.ok(preferenceService.updateAcceptedSplits(caller, body.getSplits()));
    }

    @GetMapping("/authorized-callers")
    public ResponseEntity<Set<String>> getAuthorizedCallers() {
        return ResponseEntity.ok(accessControlService.getAuthorizedCallers());
    }

    @GetMapping("/authorized-callers/{target}")
    public ResponseEntity<Map<String, Object>> isAuthorizedCaller(@PathVariable String target) {
        return ResponseEntity.ok(Map.of("caller", target, "authorized", accessControlService.isAuthorizedCaller(target)));
    }

    @PutMapping("/authorized-callers/{target}")
    public ResponseEntity<Void> setAuthorizedCaller(@PathVariable String target,
                                                    @RequestBody AuthorizedCallerRequest body,
                                                    HttpServletRequest request) {
        String caller = userContextExtractor.requireCallerId(request);
        accessControlService.setAuthorizedCaller(caller, target, body.isAllowed());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/status")
    public ResponseEntity<RouterStatusResponse> getStatus() {
        return ResponseEntity.ok(new RouterStatusResponse(
                accessControlService.isPaused(),
                accessControlService.getAuthorizedCallers(),
                preferenceService.getAcceptedSplits()));
    }

    @PostMapping("/pause")
    public ResponseEntity<Void> pause(HttpServletRequest request) {
        accessControlService.pause(userContextExtractor.requireCallerId(request));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/unpause")
    public ResponseEntity<Void> unpause(HttpServletRequest request) {
        accessControlService.unpause(userContextExtractor.requireCallerId(request));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/custody/{asset}/emergency-withdrawals")
    public ResponseEntity<BalanceResponse> emergencyWithdraw(@PathVariable String asset,
                                                             @RequestBody EmergencyWithdrawRequest body,
                                                             HttpServletRequest request) {
        String caller = userContextExtractor.requireCallerId(request);
        return ResponseEntity.ok(new BalanceResponse(asset, null,
                custodyService.emergencyWithdraw(caller, asset, body.getRecipient(), body.getAmount())));
    }
}
