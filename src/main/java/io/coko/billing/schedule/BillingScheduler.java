package io.coko.billing.schedule;

import io.coko.billing.batch.RenewalJobLauncher;
import io.coko.billing.config.BillingEngineProperties;
import io.coko.billing.invoice.InvoiceManager;
import io.coko.billing.royalty.RoyaltyPeriod;
import io.coko.billing.task.BillingTaskQueue;
import io.coko.billing.task.BillingTaskWorker;
import io.coko.billing.task.TaskType;
import io.coko.billing.util.LoggingUtils;
import org.quartz.CronScheduleBuilder;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.quartz.QuartzJobBean;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TimeZone;
import java.util.UUID;

/**
 * Quartz schedules for the background work of the engine: renewal runs, draining the task
 * queue, the overdue sweep and the monthly royalty computation.
 * Configure via {@code coko.billing.scheduling.*}.
 */
@Configuration
@ConditionalOnProperty(name = "coko.billing.scheduling.enabled", havingValue = "true", matchIfMissing = false)
public class BillingScheduler {

    private static final Logger log = LoggerFactory.getLogger(BillingScheduler.class);

    private static final String GROUP = "billingGroup";

    @Bean
    public JobDetail renewalJobDetail() {
        return JobBuilder.newJob(RenewalQuartzJob.class).withIdentity("renewalJob", GROUP).storeDurably().build();
    }

    @Bean
    public Trigger renewalJobTrigger(BillingEngineProperties props) {
        return cronTrigger(renewalJobDetail(), "renewalTrigger", props.getScheduling().getRenewalCron());
    }

    @Bean
    public JobDetail taskDrainJobDetail() {
        return JobBuilder.newJob(TaskDrainQuartzJob.class).withIdentity("taskDrainJob", GROUP).storeDurably().build();
    }

    @Bean
    public Trigger taskDrainJobTrigger(BillingEngineProperties props) {
        return cronTrigger(taskDrainJobDetail(), "taskDrainTrigger", props.getScheduling().getTaskDrainCron());
    }

    @Bean
    public JobDetail overdueJobDetail() {
        return JobBuilder.newJob(OverdueSweepQuartzJob.class).withIdentity("overdueJob", GROUP).storeDurably().build();
    }

    @Bean
    public Trigger overdueJobTrigger(BillingEngineProperties props) {
        return cronTrigger(overdueJobDetail(), "overdueTrigger", props.getScheduling().getOverdueCron());
    }

    @Bean
    public JobDetail royaltyJobDetail() {
        return JobBuilder.newJob(RoyaltyQuartzJob.class).withIdentity("royaltyJob", GROUP).storeDurably().build();
    }

    @Bean
    public Trigger royaltyJobTrigger(BillingEngineProperties props) {
        return cronTrigger(royaltyJobDetail(), "royaltyTrigger", props.getScheduling().getRoyaltyCron());
    }

    private static Trigger cronTrigger(JobDetail job, String name, String cronExpression) {
        log.info("Scheduling {}: cron={}", job.getKey().getName(), cronExpression);
        return TriggerBuilder.newTrigger()
            .forJob(job)
            .withIdentity(name, GROUP)
            .withSchedule(CronScheduleBuilder.cronSchedule(cronExpression).inTimeZone(TimeZone.getTimeZone("UTC")))
            .build();
    }

    @DisallowConcurrentExecution
    public static class RenewalQuartzJob extends QuartzJobBean {

        private final RenewalJobLauncher launcher;

        public RenewalQuartzJob(RenewalJobLauncher launcher) {
            this.launcher = launcher;
        }

        @Override
        protected void executeInternal(JobExecutionContext context) throws JobExecutionException {
            String correlationId = LoggingUtils.generateCorrelationId();
            LoggingUtils.setCorrelationId(correlationId);
            try {
                log.info("Scheduled renewal run triggered: scheduleId={}", context.getTrigger().getKey().getName());
                launcher.launch(null, "scheduler", correlationId);
            } catch (RuntimeException e) {
                log.error("Failed to execute scheduled renewal run", e);
                throw new JobExecutionException("Failed to execute scheduled renewal run", e);
            } finally {
                LoggingUtils.clearContext();
            }
        }
    }

    @DisallowConcurrentExecution
    public static class TaskDrainQuartzJob extends QuartzJobBean {

        private final BillingTaskWorker worker;

        public TaskDrainQuartzJob(BillingTaskWorker worker) {
            this.worker = worker;
        }

        @Override
        protected void executeInternal(JobExecutionContext context) throws JobExecutionException {
            try {
                int processed = worker.drain();
                if (processed > 0) {
                    log.info("Task queue drained: processed={}", processed);
                }
            } catch (RuntimeException e) {
                log.error("Failed to drain task queue", e);
                throw new JobExecutionException("Failed to drain task queue", e);
            }
        }
    }

    @DisallowConcurrentExecution
    public static class OverdueSweepQuartzJob extends QuartzJobBean {

        private final InvoiceManager invoiceManager;
        private final Clock clock;

        public OverdueSweepQuartzJob(InvoiceManager invoiceManager, Clock clock) {
            this.invoiceManager = invoiceManager;
            this.clock = clock;
        }

        @Override
        protected void executeInternal(JobExecutionContext context) throws JobExecutionException {
            try {
                int overdue = invoiceManager.markOverdueInvoices(clock.instant());
                log.info("Overdue sweep finished: invoicesMarkedOverdue={}", overdue);
            } catch (RuntimeException e) {
                log.error("Failed to run overdue sweep", e);
                throw new JobExecutionException("Failed to run overdue sweep", e);
            }
        }
    }

    /**
     * Queues the royalty computation of the previous calendar month (UTC). The dedupe key makes
     * a second trigger for the same month a no-op.
     */
    @DisallowConcurrentExecution
    public static class RoyaltyQuartzJob extends QuartzJobBean {

        private final BillingTaskQueue taskQueue;
        private final Clock clock;

        public RoyaltyQuartzJob(BillingTaskQueue taskQueue, Clock clock) {
            this.taskQueue = taskQueue;
            this.clock = clock;
        }

        @Override
        protected void executeInternal(JobExecutionContext context) throws JobExecutionException {
            Instant now = clock.instant();
            YearMonth month = YearMonth.from(now.atZone(ZoneOffset.UTC)).minusMonths(1);
            RoyaltyPeriod period = RoyaltyPeriod.ofMonth(month);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("periodStart", period.getStart().toString());
            payload.put("periodEnd", period.getEnd().toString());
            try {
                Optional<UUID> taskId = taskQueue.enqueueIfAbsent(TaskType.COMPUTE_ROYALTIES, payload, "royalty:" + month, now);
                log.info("Royalty computation queued: period={} taskId={}", period, taskId.map(UUID::toString).orElse("already queued"));
            } catch (RuntimeException e) {
                log.error("Failed to queue royalty computation: period={}", period, e);
                throw new JobExecutionException("Failed to queue royalty computation", e);
            }
        }
    }
}
