package com.give.payout.api.controller;

import com.give.payout.api.dto.PreferenceRequest;
import com.give.payout.api.service.UserContextExtractor;
import com.give.payout.application.service.AllocationPreferenceService;
import com.give.payout.domain.model.AllocationPreference;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;

@RestController
@RequestMapping("/api/preferences")
public class PreferenceController {

    private final AllocationPreferenceService preferenceService;
    private final UserContextExtractor userContextExtractor;

    public PreferenceController(AllocationPreferenceService preferenceService,
                                UserContextExtractor userContextExtractor) {
        this.preferenceService = preferenceService;
        this.userContextExtractor = userContextExtractor;
    }

    /**
     * Only the stakeholder itself may set its preference
     */
    @PutMapping("/{stakeholder}")
    public ResponseEntity<AllocationPreference> setPreference(@PathVariable String stakeholder,
                                                              @RequestBody PreferenceRequest body,
                                                              HttpServletRequest request) {
        String caller = userContextExtractor.requireCallerId(request);
        return ResponseEntity.ok(preferenceService.setPreference(
                caller, stakeholder, body.getBeneficiary(), body.getSplitPercent()));
    }

    @GetMapping("/{stakeholder}")
    public ResponseEntity<AllocationPreference> getPreference(@PathVariable String stakeholder) {
        return ResponseEntity.ok(preferenceService.getPreference(stakeholder));
    }

    @GetMapping("/accepted-splits")
    public ResponseEntity<Set<Integer>> getAcceptedSplits() {
        return ResponseEntity.ok(preferenceService.getAcceptedSplits());
    }
}
