package io.coko.billing.api;

import io.coko.billing.reconciliation.ReconciliationService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * Ledger reconciliation reports. Every report run is audited.
 */
@RestController
@RequestMapping("/api/billing/reconciliation")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;
    private final Clock clock;

    public ReconciliationController(ReconciliationService reconciliationService, Clock clock) {
        this.reconciliationService = reconciliationService;
        this.clock = clock;
    }

    /**
     * GET /api/billing/reconciliation/daily?date=2026-02-01 (defaults to today, UTC)
     */
    @GetMapping("/daily")
    public ResponseEntity<Map<String, Object>> getDailyReconciliation(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        if (date == null) {
            date = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        }
        return ResponseEntity.ok(reconciliationService.generateDailyReconciliation(date, ApiRequests.actor()));
    }
}
