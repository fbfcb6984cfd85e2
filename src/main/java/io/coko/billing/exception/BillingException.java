package io.coko.billing.exception;

/**
 * Base exception for billing engine errors.
 * Carries a coarse error code that is safe to return to API callers.
 */
public class BillingException extends RuntimeException {

    private final String errorCode;

    public BillingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BillingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
