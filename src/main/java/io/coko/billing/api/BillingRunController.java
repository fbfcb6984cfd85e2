package io.coko.billing.api;

import io.coko.billing.batch.BillingRunRepository;
import io.coko.billing.batch.RenewalJobLauncher;
import io.coko.billing.exception.NotFoundException;
import io.coko.billing.ratelimit.BillingRateLimiter;
import io.coko.billing.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/billing")
public class BillingRunController {

	private static final Logger log = LoggerFactory.getLogger(BillingRunController.class);

	private static final int MAX_ITEM_LIMIT = 10000;

	private final RenewalJobLauncher jobLauncher;
	private final BillingRunRepository repo;
	private final BillingRateLimiter rateLimiter;
	private final Clock clock;

	public BillingRunController(RenewalJobLauncher jobLauncher, BillingRunRepository repo,
			BillingRateLimiter rateLimiter, Clock clock) {
		this.jobLauncher = jobLauncher;
		this.repo = repo;
		this.rateLimiter = rateLimiter;
		this.clock = clock;
	}

	// POST /api/billing/renewals/run
	// POST /api/billing/renewals/run?asOf=2026-02-01T00:00:00Z
	@PostMapping("/renewals/run")
	public ResponseEntity<Map<String, Object>> run(@RequestParam(name = "asOf", required = false) String asOfStr) {
		Instant asOf = asOfStr != null ? ApiRequests.instant(asOfStr, "asOf") : clock.instant();

		if (!rateLimiter.tryConsumeJobLaunch()) {
			log.warn("Renewal job launch rate limit exceeded: asOf={}", asOf);
			return ResponseEntity.status(429).body(Map.of(
				"error", "rate_limited",
				"retryAfter", "1 hour"
			));
		}

		String correlationId = LoggingUtils.generateCorrelationId();
		LoggingUtils.setCorrelationId(correlationId);
		try {
			JobExecution exec = jobLauncher.launch(asOf, ApiRequests.actor(), correlationId);

			Map<String, Object> resp = new LinkedHashMap<>();
			resp.put("correlationId", correlationId);
			resp.put("jobExecutionId", exec.getId());
			resp.put("jobStatus", exec.getStatus().toString());
			resp.put("billingRunId", RenewalJobLauncher.billingRunId(exec));
			resp.put("asOf", asOf.toString());
			if (exec.getStatus() == BatchStatus.FAILED) {
				resp.put("error", "Renewal run failed. Please contact support with correlationId: " + correlationId);
			}
			return ResponseEntity.ok(resp);
		} finally {
			LoggingUtils.clearContext();
		}
	}

	// GET /api/billing/runs?limit=20
	@GetMapping("/runs")
	public ResponseEntity<List<Map<String, Object>>> recent(@RequestParam(name = "limit", defaultValue = "20") int limit) {
		return ResponseEntity.ok(repo.recentRuns(Math.max(1, Math.min(limit, 100))));
	}

	// GET /api/billing/runs/{billingRunId}?limit=200
	@GetMapping("/runs/{billingRunId}")
	public ResponseEntity<Map<String, Object>> run(@PathVariable String billingRunId,
			@RequestParam(name = "limit", defaultValue = "200") int limit) {
		UUID runId = ApiRequests.uuid(billingRunId, "billingRunId");
		Map<String, Object> run = repo.findRun(runId)
			.orElseThrow(() -> new NotFoundException("billing run", runId));
		if (limit <= 0) {
			limit = 200;
		}
		if (limit > MAX_ITEM_LIMIT) {
			log.warn("Limit exceeds maximum, capping at {}: requested={}", MAX_ITEM_LIMIT, limit);
			limit = MAX_ITEM_LIMIT;
		}

		Map<String, Object> resp = new LinkedHashMap<>(run);
		resp.put("countsByResult", repo.countsByResult(runId));
		resp.put("items", repo.items(runId, limit));
		return ResponseEntity.ok(resp);
	}
}
