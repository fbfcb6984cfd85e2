package io.coko.billing.batch.listener;

import io.coko.billing.batch.model.DueSubscriptionRow;
import io.coko.billing.batch.model.RenewalWorkItem;
import io.coko.billing.dlq.DeadLetterQueueService;
import io.coko.billing.exception.BillingException;
import io.coko.billing.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.SkipListener;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.scope.context.StepContext;
import org.springframework.batch.core.scope.context.StepSynchronizationManager;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Sends renewals the job had to skip to the Dead Letter Queue as {@code RENEWAL} entries.
 * The subscription itself stays due and is picked up again by the next run.
 */
@Component
public class RenewalSkipListener implements SkipListener<DueSubscriptionRow, RenewalWorkItem> {

    private static final Logger log = LoggerFactory.getLogger(RenewalSkipListener.class);

    static final String SOURCE_TYPE = "RENEWAL";

    private final DeadLetterQueueService dlqService;

    public RenewalSkipListener(DeadLetterQueueService dlqService) {
        this.dlqService = dlqService;
    }

    private UUID getBillingRunId() {
        StepContext stepContext = StepSynchronizationManager.getContext();
        if (stepContext == null) {
            return null;
        }
        StepExecution stepExecution = stepContext.getStepExecution();
        String runIdStr = stepExecution.getJobExecution().getExecutionContext().getString("billingRunId", null);
        return runIdStr != null ? UUID.fromString(runIdStr) : null;
    }

    @Override
    public void onSkipInRead(Throwable t) {
        // No subscription context to put in the DLQ
        log.warn("Item skipped during read: error={}", t.getMessage(), t);
    }

    @Override
    public void onSkipInProcess(DueSubscriptionRow item, Throwable t) {
        LoggingUtils.setSubscriptionId(item.getSubscriptionId());
        log.warn("Renewal skipped during processing: subscriptionId={} error={}", item.getSubscriptionId(), t.getMessage(), t);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("billingRunId", String.valueOf(getBillingRunId()));
        payload.put("subscriptionId", item.getSubscriptionId().toString());
        payload.put("userRef", item.getUserRef());
        payload.put("status", item.getStatus());
        dlqService.addToDLQ(SOURCE_TYPE, item.getSubscriptionId().toString(), payload, t, determineErrorType(t));
        LoggingUtils.clearSubscriptionId();
    }

    @Override
    public void onSkipInWrite(RenewalWorkItem item, Throwable t) {
        LoggingUtils.setSubscriptionId(item.getSubscriptionId());
        log.warn("Renewal result skipped during writing: subscriptionId={} billingRunId={} error={}",
            item.getSubscriptionId(), item.getBillingRunId(), t.getMessage(), t);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("billingRunId", String.valueOf(item.getBillingRunId()));
        payload.put("subscriptionId", item.getSubscriptionId().toString());
        payload.put("result", item.getResult());
        dlqService.addToDLQ(SOURCE_TYPE, item.getSubscriptionId().toString(), payload, t, determineErrorType(t));
        LoggingUtils.clearSubscriptionId();
    }

    static String determineErrorType(Throwable t) {
        if (t == null) {
            return "UNKNOWN";
        }
        if (t instanceof BillingException) {
            return ((BillingException) t).getErrorCode();
        }
        if (t instanceof DataAccessException) {
            return "DatabaseError";
        }
        return t.getClass().getSimpleName();
    }
}
