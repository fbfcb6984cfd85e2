package io.coko.billing.batch.processor;

import io.coko.billing.batch.model.DueSubscriptionRow;
import io.coko.billing.batch.model.RenewalWorkItem;
import io.coko.billing.subscription.RecurringBillingOrchestrator;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Configuration
public class RenewalProcessorConfig {

  @Bean
  @StepScope
  public ItemProcessor<DueSubscriptionRow, RenewalWorkItem> renewalItemProcessor(
      RecurringBillingOrchestrator orchestrator,
      PlatformTransactionManager txManager,
      Clock clock,
      @Value("#{jobExecutionContext['billingRunId']}") String runIdStr,
      @Value("#{jobParameters['asOf']}") String asOfStr) {
    TransactionTemplate outsideChunkTx = new TransactionTemplate(txManager);
    outsideChunkTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_NOT_SUPPORTED);
    return new RenewalItemProcessor(orchestrator, outsideChunkTx, clock, UUID.fromString(runIdStr), Instant.parse(asOfStr));
  }
}
