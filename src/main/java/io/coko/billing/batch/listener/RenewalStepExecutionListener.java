package io.coko.billing.batch.listener;

import io.coko.billing.metrics.BillingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.StepExecutionListener;
import org.springframework.stereotype.Component;

/**
 * Logs the counters of the renewal sweep and reports skipped subscriptions to metrics.
 */
@Component
public class RenewalStepExecutionListener implements StepExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(RenewalStepExecutionListener.class);

    private final BillingMetrics metrics;

    public RenewalStepExecutionListener(BillingMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void beforeStep(StepExecution stepExecution) {
        String runId = stepExecution.getJobExecution().getExecutionContext().getString("billingRunId", "unknown");
        log.info("Renewal sweep starting: billingRunId={} jobExecutionId={}", runId, stepExecution.getJobExecutionId());
    }

    @Override
    public ExitStatus afterStep(StepExecution stepExecution) {
        // filtered = due at read time but not due (or claimed elsewhere) by the time it was ticked
        log.info("Renewal sweep finished: due={} ticked={} notDueOrClaimed={} skipped={} rollbacks={}",
            stepExecution.getReadCount(),
            stepExecution.getWriteCount(),
            stepExecution.getFilterCount(),
            stepExecution.getSkipCount(),
            stepExecution.getRollbackCount());

        if (stepExecution.getSkipCount() > 0) {
            metrics.recordRenewalSkipped(stepExecution.getSkipCount());
        }
        if (stepExecution.getReadCount() == 0) {
            log.info("No subscription was due for renewal in this run");
        }
        return stepExecution.getExitStatus();
    }
}
