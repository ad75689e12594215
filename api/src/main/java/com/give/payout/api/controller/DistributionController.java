package com.give.payout.api.controller;

import com.give.payout.api.dto.AmountRequest;
import com.give.payout.api.dto.EqualSplitRequest;
import com.give.payout.api.service.UserContextExtractor;
import com.give.payout.application.service.DistributionService;
import com.give.payout.domain.model.DistributionResult;
import com.give.payout.domain.model.DistributionStatsView;
import com.give.payout.domain.model.FeeSplit;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * Direct distribution modes and distribution read models
 */
@RestController
@RequestMapping("/api/distributions")
public class DistributionController {

    private final DistributionService distributionService;
    private final UserContextExtractor userContextExtractor;

    public DistributionController(DistributionService distributionService,
                                  UserContextExtractor userContextExtractor) {
        this.distributionService = distributionService;
        this.userContextExtractor = userContextExtractor;
    }

    @PostMapping("/{asset}/single")
    public ResponseEntity<DistributionResult> distributeSingle(@PathVariable String asset,
                                                               @RequestBody AmountRequest body,
                                                               HttpServletRequest request) {
        String caller = userContextExtractor.requireCallerId(request);
        return ResponseEntity.ok(distributionService.distributeSingle(caller, asset, body.getAmount()));
    }

    @PostMapping("/{asset}/equal-split")
    public ResponseEntity<DistributionResult> distributeEqualSplit(@PathVariable String asset,
                                                                   @RequestBody EqualSplitRequest body,
                                                                   HttpServletRequest request) {
        String caller = userContextExtractor.requireCallerId(request);
        return ResponseEntity.ok(distributionService.distributeEqualSplit(
                caller, asset, body.getAmount(), body.getBeneficiaries()));
    }

    @PostMapping("/{asset}/proportional")
    public ResponseEntity<DistributionResult> distributeProportional(@PathVariable String asset,
                                                                     @RequestBody AmountRequest body,
                                                                     HttpServletRequest request) {
        String caller = userContextExtractor.requireCallerId(request);
        return ResponseEntity.ok(distributionService.distributeProportional(caller, asset, body.getAmount()));
    }

    @GetMapping("/preview")
    public ResponseEntity<FeeSplit> preview(@RequestParam BigInteger amount) {
        return ResponseEntity.ok(distributionService.previewDistribution(amount));
    }

    @GetMapping("/{asset}/stats")
    public ResponseEntity<DistributionStatsView> getStats(@PathVariable String asset) {
        return ResponseEntity.ok(distributionService.getDistributionStats(asset));
    }
}
