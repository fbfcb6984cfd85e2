package io.coko.billing.batch.reader;

import io.coko.billing.batch.model.DueSubscriptionRow;
import io.coko.billing.config.BillingEngineProperties;
import io.coko.billing.subscription.SubscriptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.item.database.JdbcPagingItemReader;
import org.springframework.batch.item.database.Order;
import org.springframework.batch.item.database.builder.JdbcPagingItemReaderBuilder;
import org.springframework.batch.item.database.support.PostgresPagingQueryProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Configuration
public class DueSubscriptionReaderConfig {

	private static final Logger log = LoggerFactory.getLogger(DueSubscriptionReaderConfig.class);

  @Bean
  @StepScope
  public JdbcPagingItemReader<DueSubscriptionRow> dueSubscriptionReader(
      DataSource dataSource,
      BillingEngineProperties props,
      @Value("#{jobParameters['asOf']}") String asOfStr,
      @Value("#{jobExecutionContext['billingRunId']}") String billingRunIdStr) {
    Instant asOf = Instant.parse(asOfStr);
    Instant staleBefore = asOf.minusSeconds(props.getOrchestrator().getStaleClaimSeconds());
    log.info("Creating due subscription paging reader: asOf={} staleBefore={} billingRunId={}",
        asOf, staleBefore, billingRunIdStr);

    PostgresPagingQueryProvider queryProvider = new PostgresPagingQueryProvider();
    queryProvider.setSelectClause("id, user_ref, status, version");
    queryProvider.setFromClause("recurring_billing");
    // A subscription is ticked at most once per run
    queryProvider.setWhereClause(
        "(" + SubscriptionRepository.DUE_WHERE_CLAUSE + ") " +
        "AND NOT EXISTS (SELECT 1 FROM billing_run_item h " +
        "WHERE h.billing_run_id = :billingRunId AND h.subscription_id = recurring_billing.id)");

    Map<String, Order> sortKeys = new HashMap<>();
    sortKeys.put("id", Order.ASCENDING);
    queryProvider.setSortKeys(sortKeys);

    Map<String, Object> parameterValues = new HashMap<>();
    parameterValues.put("asOf", Timestamp.from(asOf));
    parameterValues.put("staleBefore", Timestamp.from(staleBefore));
    parameterValues.put("billingRunId", UUID.fromString(billingRunIdStr));

    return new JdbcPagingItemReaderBuilder<DueSubscriptionRow>()
      .name("dueSubscriptionReader")
      .dataSource(dataSource)
      .queryProvider(queryProvider)
      .parameterValues(parameterValues)
      .pageSize(props.getChunkSize())
      .rowMapper(new DueSubscriptionRowMapper())
      .build();
  }
}
