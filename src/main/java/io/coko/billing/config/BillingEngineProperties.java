package io.coko.billing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.RoundingMode;

/**
 * Operational settings of the billing engine.
 * Business rules (rates, thresholds, dunning schedule) are not here: they live in the
 * versioned configuration store so they can be resolved as of a past instant.
 */
@Component
@ConfigurationProperties(prefix = "coko.billing")
public class BillingEngineProperties {
	private String billingEntity = "COKO";
	private int invoiceNumberDigits = 6;
	private int chunkSize = 100;

	private Royalty royalty = new Royalty();
	private ProviderRetry providerRetry = new ProviderRetry();
	private Orchestrator orchestrator = new Orchestrator();
	private Tasks tasks = new Tasks();
	private RateLimit rateLimit = new RateLimit();
	private Scheduling scheduling = new Scheduling();
	private Providers providers = new Providers();

	public String getBillingEntity() {
		return billingEntity;
	}

	public void setBillingEntity(String billingEntity) {
		this.billingEntity = billingEntity;
	}

	public int getInvoiceNumberDigits() {
		return invoiceNumberDigits;
	}

	public void setInvoiceNumberDigits(int invoiceNumberDigits) {
		this.invoiceNumberDigits = invoiceNumberDigits;
	}

	public int getChunkSize() {
		return chunkSize;
	}

	public void setChunkSize(int chunkSize) {
		this.chunkSize = chunkSize;
	}

	public Royalty getRoyalty() {
		return royalty;
	}

	public void setRoyalty(Royalty royalty) {
		this.royalty = royalty;
	}

	public ProviderRetry getProviderRetry() {
		return providerRetry;
	}

	public void setProviderRetry(ProviderRetry providerRetry) {
		this.providerRetry = providerRetry;
	}

	public Orchestrator getOrchestrator() {
		return orchestrator;
	}

	public void setOrchestrator(Orchestrator orchestrator) {
		this.orchestrator = orchestrator;
	}

	public Tasks getTasks() {
		return tasks;
	}

	public void setTasks(Tasks tasks) {
		this.tasks = tasks;
	}

	public RateLimit getRateLimit() {
		return rateLimit;
	}

	public void setRateLimit(RateLimit rateLimit) {
		this.rateLimit = rateLimit;
	}

	public Scheduling getScheduling() {
		return scheduling;
	}

	public void setScheduling(Scheduling scheduling) {
		this.scheduling = scheduling;
	}

	public Providers getProviders() {
		return providers;
	}

	public void setProviders(Providers providers) {
		this.providers = providers;
	}

	public static class Royalty {
		private RoundingMode roundingMode = RoundingMode.HALF_EVEN;

		public RoundingMode getRoundingMode() {
			return roundingMode;
		}

		public void setRoundingMode(RoundingMode roundingMode) {
			this.roundingMode = roundingMode;
		}
	}

	public static class ProviderRetry {
		private int maxAttempts = 3;
		private long initialIntervalMs = 1000;
		private double multiplier = 2.0;
		private long maxIntervalMs = 10000;

		public int getMaxAttempts() {
			return maxAttempts;
		}

		public void setMaxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
		}

		public long getInitialIntervalMs() {
			return initialIntervalMs;
		}

		public void setInitialIntervalMs(long initialIntervalMs) {
			this.initialIntervalMs = initialIntervalMs;
		}

		public double getMultiplier() {
			return multiplier;
		}

		public void setMultiplier(double multiplier) {
			this.multiplier = multiplier;
		}

		public long getMaxIntervalMs() {
			return maxIntervalMs;
		}

		public void setMaxIntervalMs(long maxIntervalMs) {
			this.maxIntervalMs = maxIntervalMs;
		}
	}

	public static class Orchestrator {
		private long transientRetryDelaySeconds = 3600;      // after provider retries are exhausted
		private long staleClaimSeconds = 900;                // RENEWAL_PENDING without a live attempt
		private long pendingChargeTimeoutSeconds = 86400;    // re-send a PENDING attempt with the same key

		public long getTransientRetryDelaySeconds() {
			return transientRetryDelaySeconds;
		}

		public void setTransientRetryDelaySeconds(long transientRetryDelaySeconds) {
			this.transientRetryDelaySeconds = transientRetryDelaySeconds;
		}

		public long getStaleClaimSeconds() {
			return staleClaimSeconds;
		}

		public void setStaleClaimSeconds(long staleClaimSeconds) {
			this.staleClaimSeconds = staleClaimSeconds;
		}

		public long getPendingChargeTimeoutSeconds() {
			return pendingChargeTimeoutSeconds;
		}

		public void setPendingChargeTimeoutSeconds(long pendingChargeTimeoutSeconds) {
			this.pendingChargeTimeoutSeconds = pendingChargeTimeoutSeconds;
		}
	}

	public static class Tasks {
		private int maxAttempts = 5;
		private int batchSize = 50;
		private long leaseSeconds = 60;
		private long backoffSeconds = 30;
		private boolean runInline = true;

		public int getMaxAttempts() {
			return maxAttempts;
		}

		public void setMaxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
		}

		public int getBatchSize() {
			return batchSize;
		}

		public void setBatchSize(int batchSize) {
			this.batchSize = batchSize;
		}

		public long getLeaseSeconds() {
			return leaseSeconds;
		}

		public void setLeaseSeconds(long leaseSeconds) {
			this.leaseSeconds = leaseSeconds;
		}

		public long getBackoffSeconds() {
			return backoffSeconds;
		}

		public void setBackoffSeconds(long backoffSeconds) {
			this.backoffSeconds = backoffSeconds;
		}

		public boolean isRunInline() {
			return runInline;
		}

		public void setRunInline(boolean runInline) {
			this.runInline = runInline;
		}
	}

	public static class RateLimit {
		private int webhookPerSecond = 50;
		private int apiPerMinute = 100;
		private int jobLaunchesPerHour = 10;

		public int getWebhookPerSecond() {
			return webhookPerSecond;
		}

		public void setWebhookPerSecond(int webhookPerSecond) {
			this.webhookPerSecond = webhookPerSecond;
		}

		public int getApiPerMinute() {
			return apiPerMinute;
		}

		public void setApiPerMinute(int apiPerMinute) {
			this.apiPerMinute = apiPerMinute;
		}

		public int getJobLaunchesPerHour() {
			return jobLaunchesPerHour;
		}

		public void setJobLaunchesPerHour(int jobLaunchesPerHour) {
			this.jobLaunchesPerHour = jobLaunchesPerHour;
		}
	}

	public static class Scheduling {
		private boolean enabled = false;
		private String renewalCron = "0 0 * * * ?";        // hourly
		private String taskDrainCron = "0 * * * * ?";      // every minute
		private String overdueCron = "0 30 1 * * ?";       // daily 01:30
		private String royaltyCron = "0 0 3 1 * ?";        // 1st of month 03:00

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public String getRenewalCron() {
			return renewalCron;
		}

		public void setRenewalCron(String renewalCron) {
			this.renewalCron = renewalCron;
		}

		public String getTaskDrainCron() {
			return taskDrainCron;
		}

		public void setTaskDrainCron(String taskDrainCron) {
			this.taskDrainCron = taskDrainCron;
		}

		public String getOverdueCron() {
			return overdueCron;
		}

		public void setOverdueCron(String overdueCron) {
			this.overdueCron = overdueCron;
		}

		public String getRoyaltyCron() {
			return royaltyCron;
		}

		public void setRoyaltyCron(String royaltyCron) {
			this.royaltyCron = royaltyCron;
		}
	}

	public static class Providers {
		private Card card = new Card();
		private OrangeMoney orangeMoney = new OrangeMoney();
		private MtnMomo mtnMomo = new MtnMomo();

		public Card getCard() {
			return card;
		}

		public void setCard(Card card) {
			this.card = card;
		}

		public OrangeMoney getOrangeMoney() {
			return orangeMoney;
		}

		public void setOrangeMoney(OrangeMoney orangeMoney) {
			this.orangeMoney = orangeMoney;
		}

		public MtnMomo getMtnMomo() {
			return mtnMomo;
		}

		public void setMtnMomo(MtnMomo mtnMomo) {
			this.mtnMomo = mtnMomo;
		}
	}

	public static class Card {
		private String baseUrl = "http://localhost:8020";
		private String chargePath = "/v1/charges";
		private String apiKey;
		private String webhookSecret;
		private long signatureToleranceSeconds = 300;
		private int timeoutMs = 8000;

		public String getBaseUrl() {
			return baseUrl;
		}

		public void setBaseUrl(String baseUrl) {
			this.baseUrl = baseUrl;
		}

		public String getChargePath() {
			return chargePath;
		}

		public void setChargePath(String chargePath) {
			this.chargePath = chargePath;
		}

		public String getApiKey() {
			return apiKey;
		}

		public void setApiKey(String apiKey) {
			this.apiKey = apiKey;
		}

		public String getWebhookSecret() {
			return webhookSecret;
		}

		public void setWebhookSecret(String webhookSecret) {
			this.webhookSecret = webhookSecret;
		}

		public long getSignatureToleranceSeconds() {
			return signatureToleranceSeconds;
		}

		public void setSignatureToleranceSeconds(long signatureToleranceSeconds) {
			this.signatureToleranceSeconds = signatureToleranceSeconds;
		}

		public int getTimeoutMs() {
			return timeoutMs;
		}

		public void setTimeoutMs(int timeoutMs) {
			this.timeoutMs = timeoutMs;
		}
	}

	public static class OrangeMoney {
		private String baseUrl = "http://localhost:8021";
		private String paymentPath = "/orange-money-webpay/dev/v1/webpayment";
		private String accessToken;
		private String merchantKey;
		private String notificationToken;
		private String notifyUrl;
		private int timeoutMs = 8000;

		public String getBaseUrl() {
			return baseUrl;
		}

		public void setBaseUrl(String baseUrl) {
			this.baseUrl = baseUrl;
		}

		public String getPaymentPath() {
			return paymentPath;
		}

		public void setPaymentPath(String paymentPath) {
			this.paymentPath = paymentPath;
		}

		public String getAccessToken() {
			return accessToken;
		}

		public void setAccessToken(String accessToken) {
			this.accessToken = accessToken;
		}

		public String getMerchantKey() {
			return merchantKey;
		}

		public void setMerchantKey(String merchantKey) {
			this.merchantKey = merchantKey;
		}

		public String getNotificationToken() {
			return notificationToken;
		}

		public void setNotificationToken(String notificationToken) {
			this.notificationToken = notificationToken;
		}

		public String getNotifyUrl() {
			return notifyUrl;
		}

		public void setNotifyUrl(String notifyUrl) {
			this.notifyUrl = notifyUrl;
		}

		public int getTimeoutMs() {
			return timeoutMs;
		}

		public void setTimeoutMs(int timeoutMs) {
			this.timeoutMs = timeoutMs;
		}
	}

	public static class MtnMomo {
		private String baseUrl = "http://localhost:8022";
		private String requestToPayPath = "/collection/v1_0/requesttopay";
		private String subscriptionKey;
		private String accessToken;
		private String targetEnvironment = "sandbox";
		private String callbackUrl;
		// PEM encoded X.509 certificate or public key of the operator's callback signer
		private String callbackPublicKey;
		private int timeoutMs = 8000;

		public String getBaseUrl() {
			return baseUrl;
		}

		public void setBaseUrl(String baseUrl) {
			this.baseUrl = baseUrl;
		}

		public String getRequestToPayPath() {
			return requestToPayPath;
		}

		public void setRequestToPayPath(String requestToPayPath) {
			this.requestToPayPath = requestToPayPath;
		}

		public String getSubscriptionKey() {
			return subscriptionKey;
		}

		public void setSubscriptionKey(String subscriptionKey) {
			this.subscriptionKey = subscriptionKey;
		}

		public String getAccessToken() {
			return accessToken;
		}

		public void setAccessToken(String accessToken) {
			this.accessToken = accessToken;
		}

		public String getTargetEnvironment() {
			return targetEnvironment;
		}

		public void setTargetEnvironment(String targetEnvironment) {
			this.targetEnvironment = targetEnvironment;
		}

		public String getCallbackUrl() {
			return callbackUrl;
		}

		public void setCallbackUrl(String callbackUrl) {
			this.callbackUrl = callbackUrl;
		}

		public String getCallbackPublicKey() {
			return callbackPublicKey;
		}

		public void setCallbackPublicKey(String callbackPublicKey) {
			this.callbackPublicKey = callbackPublicKey;
		}

		public int getTimeoutMs() {
			return timeoutMs;
		}

		public void setTimeoutMs(int timeoutMs) {
			this.timeoutMs = timeoutMs;
		}
	}
}
