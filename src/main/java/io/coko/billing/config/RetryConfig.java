package io.coko.billing.config;

import io.coko.billing.exception.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry template for payment provider calls.
 * Only {@link ProviderException.Kind#TRANSIENT} failures are retried; declines and other
 * permanent failures surface on the first attempt.
 */
@Configuration
public class RetryConfig {

	private static final Logger log = LoggerFactory.getLogger(RetryConfig.class);

	@Bean
	public RetryTemplate providerRetryTemplate(BillingEngineProperties props) {
		BillingEngineProperties.ProviderRetry settings = props.getProviderRetry();
		RetryTemplate retryTemplate = new RetryTemplate();

		TransientProviderRetryPolicy retryPolicy = new TransientProviderRetryPolicy(settings.getMaxAttempts());
		retryTemplate.setRetryPolicy(retryPolicy);

		ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
		backOffPolicy.setInitialInterval(settings.getInitialIntervalMs());
		backOffPolicy.setMultiplier(settings.getMultiplier());
		backOffPolicy.setMaxInterval(settings.getMaxIntervalMs());
		retryTemplate.setBackOffPolicy(backOffPolicy);

		retryTemplate.registerListener(new RetryListener() {
			@Override
			public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
					Throwable throwable) {
				log.warn("Provider call failed (attempt {} of {}): {}",
					context.getRetryCount(), retryPolicy.getMaxAttempts(), throwable.getMessage());
			}

			@Override
			public <T, E extends Throwable> void onSuccess(RetryContext context, RetryCallback<T, E> callback,
					T result) {
				if (context.getRetryCount() > 0) {
					log.info("Provider call succeeded after {} retries", context.getRetryCount());
				}
			}
		});

		return retryTemplate;
	}

	static class TransientProviderRetryPolicy extends SimpleRetryPolicy {

		TransientProviderRetryPolicy(int maxAttempts) {
			super(maxAttempts);
		}

		@Override
		public boolean canRetry(RetryContext context) {
			Throwable last = context.getLastThrowable();
			if (last != null && !isTransient(last)) {
				return false;
			}
			return super.canRetry(context);
		}

		private static boolean isTransient(Throwable t) {
			return t instanceof ProviderException && ((ProviderException) t).isTransient();
		}
	}
}
