package io.coko.billing.batch.processor;

import io.coko.billing.batch.model.DueSubscriptionRow;
import io.coko.billing.batch.model.RenewalWorkItem;
import io.coko.billing.subscription.RecurringBillingOrchestrator;
import io.coko.billing.subscription.TickResult;
import io.coko.billing.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.lang.NonNull;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Runs one orchestrator tick per due subscription. Ticks that find the subscription no longer
 * due (another tick got there first) are filtered out of the run.
 *
 * The tick runs outside the chunk transaction: a renewal commits on its own, so a later failure
 * in the chunk cannot roll back the record of a charge the provider already accepted.
 */
public class RenewalItemProcessor implements ItemProcessor<DueSubscriptionRow, RenewalWorkItem> {

    private static final Logger log = LoggerFactory.getLogger(RenewalItemProcessor.class);

    private final RecurringBillingOrchestrator orchestrator;
    private final TransactionTemplate outsideChunkTx;
    private final Clock clock;
    private final UUID runId;
    private final Instant asOf;

    public RenewalItemProcessor(RecurringBillingOrchestrator orchestrator, TransactionTemplate outsideChunkTx,
                                Clock clock, UUID runId, Instant asOf) {
        this.orchestrator = orchestrator;
        this.outsideChunkTx = outsideChunkTx;
        this.clock = clock;
        this.runId = runId;
        this.asOf = asOf;
    }

    @Override
    public RenewalWorkItem process(@NonNull DueSubscriptionRow row) {
        LoggingUtils.setBillingRunId(runId);
        TickResult result = outsideChunkTx.execute(status -> orchestrator.tick(row.getSubscriptionId(), asOf));
        if (result == TickResult.NOT_DUE || result == TickResult.CLAIM_LOST) {
            log.debug("Subscription not renewed in this run: subscriptionId={} result={}", row.getSubscriptionId(), result);
            return null;
        }
        log.info("Renewal processed: subscriptionId={} status={} result={}", row.getSubscriptionId(), row.getStatus(), result);

        RenewalWorkItem item = new RenewalWorkItem();
        item.setBillingRunId(runId);
        item.setSubscriptionId(row.getSubscriptionId());
        item.setResult(result.name());
        item.setProcessedAt(clock.instant());
        return item;
    }
}
