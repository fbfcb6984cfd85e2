package io.coko.billing.batch;

import io.coko.billing.audit.AuditService;
import io.coko.billing.exception.BillingException;
import io.coko.billing.metrics.BillingMetrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionException;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Launches the renewal job. Used by the operations API and the scheduler.
 */
@Service
public class RenewalJobLauncher {

	private static final Logger log = LoggerFactory.getLogger(RenewalJobLauncher.class);

	private final JobLauncher jobLauncher;
	private final Job renewalJob;
	private final BillingRunRepository repo;
	private final AuditService auditService;
	private final BillingMetrics metrics;
	private final Clock clock;

	public RenewalJobLauncher(JobLauncher jobLauncher, @Qualifier("renewalJob") Job renewalJob,
			BillingRunRepository repo, AuditService auditService, BillingMetrics metrics, Clock clock) {
		this.jobLauncher = jobLauncher;
		this.renewalJob = renewalJob;
		this.repo = repo;
		this.auditService = auditService;
		this.metrics = metrics;
		this.clock = clock;
	}

	public JobExecution launch(Instant asOf, String triggeredBy, String correlationId) {
		Instant effectiveAsOf = asOf != null ? asOf : clock.instant();
		JobParameters params = new JobParametersBuilder()
			.addString("asOf", effectiveAsOf.toString())
			.addString("triggeredBy", triggeredBy != null ? triggeredBy : "system")
			.addString("correlationId", correlationId)
			.addLong("ts", clock.millis())
			.toJobParameters();

		log.info("Launching renewal job: correlationId={} asOf={} triggeredBy={}", correlationId, effectiveAsOf, triggeredBy);
		Timer.Sample timer = metrics.startTimer();
		JobExecution exec;
		try {
			exec = jobLauncher.run(renewalJob, params);
		} catch (JobExecutionException e) {
			log.error("Failed to launch renewal job: correlationId={} asOf={}", correlationId, effectiveAsOf, e);
			throw new BillingException("unavailable", "Renewal job could not be launched", e);
		} finally {
			metrics.recordRenewalJobTime(timer);
		}

		if (exec.getStatus() == BatchStatus.FAILED) {
			String runId = billingRunId(exec);
			Throwable first = exec.getAllFailureExceptions().isEmpty() ? null : exec.getAllFailureExceptions().get(0);
			log.error("Renewal job failed: correlationId={} jobExecutionId={} billingRunId={}",
				correlationId, exec.getId(), runId, first);
			if (runId != null) {
				String error = first != null ? first.getClass().getSimpleName() + ": " + first.getMessage() : "unknown";
				repo.failRunIfRunning(UUID.fromString(runId), error, clock.instant());
				auditService.logJobFailed(UUID.fromString(runId), error, triggeredBy);
			}
		} else {
			log.info("Renewal job finished: correlationId={} jobExecutionId={} billingRunId={} status={}",
				correlationId, exec.getId(), billingRunId(exec), exec.getStatus());
		}
		return exec;
	}

	public static String billingRunId(JobExecution exec) {
		return exec.getExecutionContext().containsKey("billingRunId")
			? exec.getExecutionContext().getString("billingRunId")
			: null;
	}
}
