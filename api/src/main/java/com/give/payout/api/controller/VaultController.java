package com.give.payout.api.controller;

import com.give.payout.api.dto.AmountRequest;
import com.give.payout.api.dto.BalanceResponse;
import com.give.payout.api.dto.SetSharesRequest;
import com.give.payout.api.dto.ShareBookResponse;
import com.give.payout.api.service.UserContextExtractor;
import com.give.payout.application.service.CustodyService;
import com.give.payout.application.service.DistributionService;
import com.give.payout.application.service.ShareLedgerService;
import com.give.payout.domain.model.DistributionResult;
import com.give.payout.domain.model.ShareChange;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Synchronous entry points for a vault: share writes, deposits and harvests.
 * The same operations arrive asynchronously through the vault event topic.
 */
@RestController
@RequestMapping("/api/vault/{asset}")
public class VaultController {

    private final ShareLedgerService shareLedgerService;
    private final CustodyService custodyService;
    private final DistributionService distributionService;
    private final UserContextExtractor userContextExtractor;

    public VaultController(ShareLedgerService shareLedgerService,
                           CustodyService custodyService,
                           DistributionService distributionService,
                           UserContextExtractor userContextExtractor) {
        this.shareLedgerService = shareLedgerService;
        this.custodyService = custodyService;
        this.distributionService = distributionService;
        this.userContextExtractor = userContextExtractor;
    }

    @PutMapping("/shares/{stakeholder}")
    public ResponseEntity<ShareChange> setShares(@PathVariable String asset,
                                                 @PathVariable String stakeholder,
                                                 @RequestBody SetSharesRequest body,
                                                 HttpServletRequest request) {
        String caller = userContextExtractor.requireCallerId(request);
        return ResponseEntity.ok(shareLedgerService.setShares(caller, stakeholder, asset, body.getAmount()));
    }

    @GetMapping("/shares/{stakeholder}")
    public ResponseEntity<BalanceResponse> getShares(@PathVariable String asset, @PathVariable String stakeholder) {
        return ResponseEntity.ok(new BalanceResponse(asset, stakeholder, shareLedgerService.getShares(stakeholder, asset)));
    }

    @GetMapping("/shares")
    public ResponseEntity<ShareBookResponse> getShareBook(@PathVariable String asset) {
        return ResponseEntity.ok(ShareBookResponse.builder()
                .asset(asset)
                .totalShares(shareLedgerService.getTotalShares(asset))
                .activeStakeholders(shareLedgerService.getActiveStakeholders(asset))
                .build());
    }

    @PostMapping("/deposits")
    public ResponseEntity<BalanceResponse> deposit(@PathVariable String asset,
                                                   @RequestBody AmountRequest body,
                                                   HttpServletRequest request) {
        String caller = userContextExtractor.requireCallerId(request);
        return ResponseEntity.ok(new BalanceResponse(asset, null, custodyService.deposit(caller, asset, body.getAmount())));
    }

    /**
     * Distribute harvested yield pro rata to current shares
     */
    @PostMapping("/harvests")
    public ResponseEntity<DistributionResult> harvest(@PathVariable String asset,
                                                      @RequestBody AmountRequest body,
                                                      HttpServletRequest request) {
        String caller = userContextExtractor.requireCallerId(request);
        return ResponseEntity.ok(distributionService.distributeProportional(caller, asset, body.getAmount()));
    }

    @GetMapping("/custody")
    public ResponseEntity<BalanceResponse> getCustodyBalance(@PathVariable String asset) {
        return ResponseEntity.ok(new BalanceResponse(asset, null, custodyService.balanceOf(asset)));
    }
}
