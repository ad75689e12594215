package com.give.payout.application.service;

import com.give.payout.application.guard.ExecutionGuard;
import com.give.payout.domain.event.AuditEvent;
import com.give.payout.domain.event.AuditEventType;
import com.give.payout.domain.model.ShareBook;
import com.give.payout.domain.model.ShareChange;
import com.give.payout.domain.store.ShareLedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

@Service
public class ShareLedgerService {

    private static final Logger log = LoggerFactory.getLogger(ShareLedgerService.class);

    private final ShareLedgerStore shareLedgerStore;
    private final AccessControlService accessControlService;
    private final ExecutionGuard executionGuard;
    private final AuditTrail auditTrail;
    private final MetricsService metricsService;

    public ShareLedgerService(ShareLedgerStore shareLedgerStore,
                              AccessControlService accessControlService,
                              ExecutionGuard executionGuard,
                              AuditTrail auditTrail,
                              MetricsService metricsService) {
        this.shareLedgerStore = shareLedgerStore;
        this.accessControlService = accessControlService;
        this.executionGuard = executionGuard;
        this.auditTrail = auditTrail;
        this.metricsService = metricsService;
    }

    /**
     * Overwrite a stakeholder's share balance for an asset.
     * Writing the current balance again changes nothing and records no event.
     */
    public ShareChange setShares(String caller, String stakeholder, String asset, BigInteger newAmount) {
        return executionGuard.execute("setShares", () -> {
            accessControlService.requireAuthorizedCaller(caller);
            PayoutValidation.requireAddress(stakeholder, "stakeholder");
            PayoutValidation.requireAddress(asset, "asset");

            ShareBook book = shareLedgerStore.load(asset);
            ShareChange change = book.setShares(stakeholder, newAmount);
            if (change.isNoOp()) {
                log.debug("Shares of {} in {} unchanged at {}", stakeholder, asset, newAmount);
                return change;
            }

            shareLedgerStore.save(book);
            auditTrail.record(AuditEvent.builder()
                    .type(AuditEventType.SHARES_UPDATED)
                    .actor(caller)
                    .asset(asset)
                    .stakeholder(stakeholder)
                    .amount(newAmount)
                    .totalShares(change.getTotalShares())
                    .oldValue(change.getOldAmount().toString())
                    .newValue(newAmount.toString())
                    .build());
            metricsService.recordShareUpdate();
            log.info("Shares of {} in {}: {} -> {} (total {}, {})", stakeholder, asset,
                    change.getOldAmount(), newAmount, change.getTotalShares(), change.getMembership());
            return change;
        });
    }

    public BigInteger getShares(String stakeholder, String asset) {
        return shareLedgerStore.load(asset).sharesOf(stakeholder);
    }

    public BigInteger getTotalShares(String asset) {
        return shareLedgerStore.load(asset).getTotalShares();
    }

    public List<String> getActiveStakeholders(String asset) {
        return List.copyOf(shareLedgerStore.load(asset).getActiveStakeholders());
    }
}
