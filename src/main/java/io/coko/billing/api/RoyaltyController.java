package io.coko.billing.api;

import io.coko.billing.api.dto.ComputeRoyaltiesRequest;
import io.coko.billing.api.dto.MarkRoyaltyPaidRequest;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.invoice.Invoice;
import io.coko.billing.royalty.AuthorRoyalty;
import io.coko.billing.royalty.RoyaltyCalculator;
import io.coko.billing.royalty.RoyaltyPeriod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/royalties")
public class RoyaltyController {

	private static final Logger log = LoggerFactory.getLogger(RoyaltyController.class);

	private final RoyaltyCalculator calculator;

	public RoyaltyController(RoyaltyCalculator calculator) {
		this.calculator = calculator;
	}

	// GET /api/royalties/author-7?start=2026-01-01&end=2026-02-01
	@GetMapping("/{authorRef}")
	public ResponseEntity<Map<String, Object>> summary(@PathVariable String authorRef,
			@RequestParam("start") String start,
			@RequestParam("end") String end) {
		RoyaltyPeriod period = RoyaltyPeriod.of(ApiRequests.date(start, "start"), ApiRequests.date(end, "end"));
		return ResponseEntity.ok(ApiViews.royaltySummary(calculator.getRoyaltySummary(authorRef, period)));
	}

	@GetMapping("/records/{royaltyId}")
	public ResponseEntity<Map<String, Object>> record(@PathVariable String royaltyId) {
		AuthorRoyalty royalty = calculator.getRoyalty(ApiRequests.uuid(royaltyId, "royaltyId"));
		return ResponseEntity.ok(ApiViews.royalty(royalty));
	}

	/**
	 * Runs a royalty computation synchronously. CORRECTION appends correction records
	 * to a period that already has paid, invoiced or carried-forward records; COMPUTE refuses such a
	 * period with 409.
	 */
	@PostMapping("/compute")
	public ResponseEntity<Map<String, Object>> compute(@RequestBody ComputeRoyaltiesRequest request) {
		RoyaltyPeriod period = RoyaltyPeriod.of(request.getPeriodStart(), request.getPeriodEnd());
		String mode = request.getMode() != null ? request.getMode().trim().toUpperCase(Locale.ROOT) : "COMPUTE";

		List<AuthorRoyalty> records;
		switch (mode) {
			case "COMPUTE":
				records = request.getAuthorRef() != null
					? calculator.computeAuthorRoyalties(request.getAuthorRef(), period)
					: calculator.computeRoyalties(period);
				break;
			case "CORRECTION":
				records = calculator.appendCorrections(period);
				break;
			default:
				throw new ValidationException("Invalid mode. Use COMPUTE or CORRECTION.", "mode", request.getMode());
		}
		log.info("Royalty computation requested: period={} mode={} records={}", period, mode, records.size());

		List<Map<String, Object>> views = new ArrayList<>();
		records.forEach(r -> views.add(ApiViews.royalty(r)));
		Map<String, Object> response = new LinkedHashMap<>();
		response.put("periodStart", period.getStart());
		response.put("periodEnd", period.getEnd());
		response.put("mode", mode);
		response.put("records", views);
		return ResponseEntity.ok(response);
	}

	// POST /api/royalties/author-7/invoices?start=2026-01-01&end=2026-02-01
	@PostMapping("/{authorRef}/invoices")
	public ResponseEntity<List<Map<String, Object>>> invoice(@PathVariable String authorRef,
			@RequestParam("start") String start,
			@RequestParam("end") String end) {
		RoyaltyPeriod period = RoyaltyPeriod.of(ApiRequests.date(start, "start"), ApiRequests.date(end, "end"));
		List<Invoice> invoices = calculator.invoiceRoyalties(authorRef, period);
		log.info("Royalty invoicing requested: author={} period={} invoices={}", authorRef, period, invoices.size());
		List<Map<String, Object>> views = new ArrayList<>();
		invoices.forEach(i -> views.add(ApiViews.invoice(i)));
		return ResponseEntity.ok(views);
	}

	@PostMapping("/{royaltyId}/paid")
	public ResponseEntity<Map<String, Object>> markPaid(@PathVariable String royaltyId,
			@RequestBody MarkRoyaltyPaidRequest request) {
		AuthorRoyalty paid = calculator.markPaid(
			ApiRequests.uuid(royaltyId, "royaltyId"),
			ApiRequests.provider(request.getProvider()),
			ApiRequests.required(request.getProviderTransactionId(), "providerTransactionId"));
		return ResponseEntity.ok(ApiViews.royalty(paid));
	}
}
