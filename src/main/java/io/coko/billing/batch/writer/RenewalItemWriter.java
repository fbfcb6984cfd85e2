package io.coko.billing.batch.writer;

import io.coko.billing.batch.BillingRunRepository;
import io.coko.billing.batch.model.RenewalWorkItem;
import io.coko.billing.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ItemWriter;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.NonNull;

public class RenewalItemWriter implements ItemWriter<RenewalWorkItem> {

	private static final Logger log = LoggerFactory.getLogger(RenewalItemWriter.class);

	private final BillingRunRepository repo;

	public RenewalItemWriter(BillingRunRepository repo) {
		this.repo = repo;
	}

	@Override
	public void write(@NonNull Chunk<? extends RenewalWorkItem> chunk) {
		for (RenewalWorkItem it : chunk) {
			LoggingUtils.setSubscriptionId(it.getSubscriptionId());
			try {
				repo.insertItem(it);
			} catch (DataAccessException e) {
				// The skip listener sends the item to the DLQ
				log.error("Failed to record renewal result: subscriptionId={} billingRunId={} result={}",
					it.getSubscriptionId(), it.getBillingRunId(), it.getResult(), e);
				throw e;
			} finally {
				LoggingUtils.clearSubscriptionId();
			}
		}
		log.debug("Renewal chunk written: items={}", chunk.size());
	}
}
