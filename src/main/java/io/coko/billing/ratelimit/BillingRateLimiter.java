package io.coko.billing.ratelimit;

import io.coko.billing.config.BillingEngineProperties;
import io.coko.billing.ledger.PaymentProvider;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Token buckets for webhook ingress (one per provider), the operations API and job launches.
 */
@Component
public class BillingRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(BillingRateLimiter.class);

    private final Map<PaymentProvider, Bucket> webhookBuckets = new EnumMap<>(PaymentProvider.class);

    private final Bucket apiBucket;

    private final Bucket jobLaunchBucket;

    public BillingRateLimiter(BillingEngineProperties props) {
        BillingEngineProperties.RateLimit limits = props.getRateLimit();
        for (PaymentProvider provider : PaymentProvider.values()) {
            webhookBuckets.put(provider, Bucket.builder()
                .addLimit(Bandwidth.classic(limits.getWebhookPerSecond(),
                    Refill.intervally(limits.getWebhookPerSecond(), Duration.ofSeconds(1))))
                .build());
        }

        this.apiBucket = Bucket.builder()
            .addLimit(Bandwidth.classic(limits.getApiPerMinute(),
                Refill.intervally(limits.getApiPerMinute(), Duration.ofMinutes(1))))
            .build();

        this.jobLaunchBucket = Bucket.builder()
            .addLimit(Bandwidth.classic(limits.getJobLaunchesPerHour(),
                Refill.intervally(limits.getJobLaunchesPerHour(), Duration.ofHours(1))))
            .build();
    }

    /**
     * @return true if the webhook may be processed, false if the provider exceeded its rate
     */
    public boolean tryConsumeWebhook(PaymentProvider provider) {
        Bucket bucket = webhookBuckets.get(provider);
        boolean consumed = bucket.tryConsume(1);
        if (!consumed) {
            log.warn("Webhook rate limit exceeded: provider={} available={}", provider, bucket.getAvailableTokens());
        }
        return consumed;
    }

    public boolean tryConsumeApi() {
        boolean consumed = apiBucket.tryConsume(1);
        if (!consumed) {
            log.warn("API rate limit exceeded. Available tokens: {}", apiBucket.getAvailableTokens());
        }
        return consumed;
    }

    public boolean tryConsumeJobLaunch() {
        boolean consumed = jobLaunchBucket.tryConsume(1);
        if (!consumed) {
            log.warn("Job launch rate limit exceeded. Available tokens: {}", jobLaunchBucket.getAvailableTokens());
        }
        return consumed;
    }

    public long getRemainingApiTokens() {
        return apiBucket.getAvailableTokens();
    }
}
