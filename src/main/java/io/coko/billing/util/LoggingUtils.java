package io.coko.billing.util;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Utility class for consistent logging with correlation IDs and context.
 */
public class LoggingUtils {

    private static final String CORRELATION_ID_KEY = "correlationId";
    private static final String BILLING_RUN_ID_KEY = "billingRunId";
    private static final String INVOICE_ID_KEY = "invoiceId";
    private static final String SUBSCRIPTION_ID_KEY = "subscriptionId";
    private static final String PROVIDER_KEY = "provider";

    private LoggingUtils() {
    }

    public static void setCorrelationId(String correlationId) {
        if (correlationId != null) {
            MDC.put(CORRELATION_ID_KEY, correlationId);
        }
    }

    public static void setBillingRunId(UUID billingRunId) {
        if (billingRunId != null) {
            MDC.put(BILLING_RUN_ID_KEY, billingRunId.toString());
        }
    }

    public static void setInvoiceId(UUID invoiceId) {
        if (invoiceId != null) {
            MDC.put(INVOICE_ID_KEY, invoiceId.toString());
        }
    }

    public static void setSubscriptionId(UUID subscriptionId) {
        if (subscriptionId != null) {
            MDC.put(SUBSCRIPTION_ID_KEY, subscriptionId.toString());
        }
    }

    public static void setProvider(String provider) {
        if (provider != null) {
            MDC.put(PROVIDER_KEY, provider);
        }
    }

    public static void clearSubscriptionId() {
        MDC.remove(SUBSCRIPTION_ID_KEY);
        MDC.remove(INVOICE_ID_KEY);
    }

    /**
     * Clear all MDC context.
     */
    public static void clearContext() {
        MDC.clear();
    }

    public static void logError(Logger logger, String message, UUID subscriptionId, UUID billingRunId, Throwable error) {
        setSubscriptionId(subscriptionId);
        setBillingRunId(billingRunId);
        logger.error("{} subscriptionId={} billingRunId={}", message, subscriptionId, billingRunId, error);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }
}
