package com.give.payout.api.controller;

import com.give.payout.application.service.AuditTrail;
import com.give.payout.domain.event.AuditEvent;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read access to the stored audit trail, newest first
 */
@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private static final int MAX_LIMIT = 500;

    private final AuditTrail auditTrail;

    public AuditController(AuditTrail auditTrail) {
        this.auditTrail = auditTrail;
    }

    @GetMapping
    public ResponseEntity<List<AuditEvent>> recent(@RequestParam(required = false) String asset,
                                                   @RequestParam(defaultValue = "50") int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        return ResponseEntity.ok(auditTrail.recent(asset, bounded));
    }
}
