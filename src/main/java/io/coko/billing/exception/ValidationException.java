package io.coko.billing.exception;

/**
 * Bad input: mismatched currencies, non-positive quantities, malformed payloads.
 * Always raised before anything is persisted.
 */
public class ValidationException extends BillingException {

    private final String fieldName;
    private final Object fieldValue;

    public ValidationException(String message) {
        this(message, null, null);
    }

    public ValidationException(String message, String fieldName, Object fieldValue) {
        super("validation_failed", message);
        this.fieldName = fieldName;
        this.fieldValue = fieldValue;
    }

    public ValidationException(String message, Throwable cause) {
        super("validation_failed", message, cause);
        this.fieldName = null;
        this.fieldValue = null;
    }

    public String getFieldName() {
        return fieldName;
    }

    public Object getFieldValue() {
        return fieldValue;
    }
}
