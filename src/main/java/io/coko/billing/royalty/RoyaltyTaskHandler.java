package io.coko.billing.royalty;

import io.coko.billing.audit.AuditService;
import io.coko.billing.exception.ImmutablePeriodException;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.task.BillingTask;
import io.coko.billing.task.BillingTaskHandler;
import io.coko.billing.task.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Runs a queued royalty computation. Payload: {@code periodStart}, {@code periodEnd} (ISO dates).
 */
@Component
public class RoyaltyTaskHandler implements BillingTaskHandler {

	private static final Logger log = LoggerFactory.getLogger(RoyaltyTaskHandler.class);

	private final RoyaltyCalculator calculator;
	private final AuditService auditService;

	public RoyaltyTaskHandler(RoyaltyCalculator calculator, AuditService auditService) {
		this.calculator = calculator;
		this.auditService = auditService;
	}

	@Override
	public TaskType taskType() {
		return TaskType.COMPUTE_ROYALTIES;
	}

	@Override
	public void handle(BillingTask task) {
		RoyaltyPeriod period = RoyaltyPeriod.of(date(task, "periodStart"), date(task, "periodEnd"));
		try {
			List<AuthorRoyalty> records = calculator.computeRoyalties(period);
			log.info("Scheduled royalty computation done: period={} records={}", period, records.size());
		} catch (ImmutablePeriodException e) {
			// A closed period stays as it is; retrying cannot succeed
			log.warn("Scheduled royalty computation skipped: period={} reason={}", period, e.getMessage());
			auditService.logEvent("ROYALTY", "ROYALTY_PERIOD", period.toString(), "COMPUTE_SKIPPED", "system",
				Map.of("reason", e.getMessage()));
		}
	}

	private static LocalDate date(BillingTask task, String key) {
		String value = task.payloadString(key);
		if (value == null) {
			throw new ValidationException("Task payload has no " + key, key, null);
		}
		try {
			return LocalDate.parse(value);
		} catch (DateTimeParseException e) {
			throw new ValidationException("Malformed " + key + ": " + value, e);
		}
	}
}
