package io.coko.billing.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.coko.billing.audit.AuditService;
import io.coko.billing.batch.listener.RenewalSkipListener;
import io.coko.billing.batch.listener.RenewalStepExecutionListener;
import io.coko.billing.batch.model.BillingRunStatus;
import io.coko.billing.batch.model.DueSubscriptionRow;
import io.coko.billing.batch.model.RenewalWorkItem;
import io.coko.billing.config.BillingEngineProperties;
import io.coko.billing.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.batch.item.ItemReader;
import org.springframework.batch.item.ItemWriter;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Renewal batch: one billing run ticks every subscription due at {@code asOf}.
 * Job parameters: {@code asOf} (ISO instant), {@code triggeredBy}, {@code correlationId}.
 */
@Configuration
public class RenewalJobConfig {

	private static final Logger log = LoggerFactory.getLogger(RenewalJobConfig.class);

	public static final String JOB_NAME = "renewalJob";

	private static final int SKIP_LIMIT = 10000;

  // -----------------------------------------------------------------------
  // Job definition
  // -----------------------------------------------------------------------

  @Bean
  public Job renewalJob(JobRepository jobRepository,
                        @Qualifier("startRunStep") Step startRunStep,
                        @Qualifier("processDueSubscriptionsStep") Step processDueSubscriptionsStep,
                        @Qualifier("endRunStep") Step endRunStep) {
    return new JobBuilder(JOB_NAME, jobRepository)
        .incrementer(new RunIdIncrementer())
        .start(startRunStep)
        .next(processDueSubscriptionsStep)
        .next(endRunStep)
        .build();
  }

  // -----------------------------------------------------------------------
  // Step 1: create billing_run and expose billingRunId in the job context
  // -----------------------------------------------------------------------

  @Bean("startRunStep")
  public Step startRunStep(JobRepository jobRepository,
                           PlatformTransactionManager txManager,
                           BillingRunRepository repo,
                           AuditService auditService,
                           Clock clock) {
    return new StepBuilder("startRunStep", jobRepository)
        .tasklet((contribution, chunkContext) -> {
          Map<String, Object> params = chunkContext.getStepContext().getJobParameters();
          Instant asOf = Instant.parse((String) params.get("asOf"));
          String triggeredBy = params.get("triggeredBy") != null ? (String) params.get("triggeredBy") : "system";
          String correlationId = (String) params.get("correlationId");

          UUID runId = repo.createRun(asOf, triggeredBy, correlationId, clock.instant());
          LoggingUtils.setBillingRunId(runId);
          log.info("Created billing run: runId={} asOf={} triggeredBy={}", runId, asOf, triggeredBy);

          JobExecution je = chunkContext.getStepContext().getStepExecution().getJobExecution();
          je.getExecutionContext().putString("billingRunId", runId.toString());

          auditService.logJobStarted(runId, asOf.toString(), triggeredBy);
          return RepeatStatus.FINISHED;
        }, txManager)
        .build();
  }

  // -----------------------------------------------------------------------
  // Step 2: tick due subscriptions in chunks (reader → processor → writer)
  // -----------------------------------------------------------------------

  @Bean("processDueSubscriptionsStep")
  public Step processDueSubscriptionsStep(JobRepository jobRepository,
                                          PlatformTransactionManager txManager,
                                          BillingEngineProperties props,
                                          ItemReader<DueSubscriptionRow> dueSubscriptionReader,
                                          ItemProcessor<DueSubscriptionRow, RenewalWorkItem> renewalItemProcessor,
                                          ItemWriter<RenewalWorkItem> renewalItemWriter,
                                          RenewalStepExecutionListener stepListener,
                                          RenewalSkipListener skipListener) {
    return new StepBuilder("processDueSubscriptionsStep", jobRepository)
        .<DueSubscriptionRow, RenewalWorkItem>chunk(props.getChunkSize(), txManager)
        .reader(dueSubscriptionReader)
        .processor(renewalItemProcessor)
        .writer(renewalItemWriter)
        .listener(stepListener)
        .faultTolerant()
        // A tick is never replayed when a chunk rolls back
        .processorNonTransactional()
        .skip(Exception.class)
        .skipLimit(SKIP_LIMIT)
        .listener(skipListener)
        .build();
  }

  // -----------------------------------------------------------------------
  // Step 3: close billing_run with a summary
  // -----------------------------------------------------------------------

  @Bean("endRunStep")
  public Step endRunStep(JobRepository jobRepository,
                         PlatformTransactionManager txManager,
                         BillingRunRepository repo,
                         ObjectMapper mapper,
                         AuditService auditService,
                         Clock clock) {
    return new StepBuilder("endRunStep", jobRepository)
        .tasklet((contribution, chunkContext) -> {
          JobExecution je = chunkContext.getStepContext().getStepExecution().getJobExecution();
          UUID runId = UUID.fromString(je.getExecutionContext().getString("billingRunId"));
          String triggeredBy = je.getJobParameters().getString("triggeredBy", "system");

          Map<String, Object> summary = new LinkedHashMap<>();
          summary.put("countsByResult", repo.countsByResult(runId));
          String summaryJson = mapper.writeValueAsString(summary);

          repo.completeRun(runId, BillingRunStatus.COMPLETED, summaryJson, clock.instant());
          log.info("Completed billing run: runId={} summary={}", runId, summaryJson);
          auditService.logJobCompleted(runId, summary, triggeredBy);
          return RepeatStatus.FINISHED;
        }, txManager)
        .build();
  }
}
