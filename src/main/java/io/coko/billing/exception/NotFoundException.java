package io.coko.billing.exception;

public class NotFoundException extends BillingException {

    private final String entityType;
    private final Object entityId;

    public NotFoundException(String entityType, Object entityId) {
        super("not_found", entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public Object getEntityId() {
        return entityId;
    }
}
