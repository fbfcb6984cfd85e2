package io.coko.billing.exception;

public class InvalidStateTransitionException extends BillingException {

    private final String entityType;
    private final Object fromState;
    private final Object toState;

    public InvalidStateTransitionException(String entityType, Object fromState, Object toState) {
        super("conflict", entityType + " cannot move from " + fromState + " to " + toState);
        this.entityType = entityType;
        this.fromState = fromState;
        this.toState = toState;
    }

    public String getEntityType() {
        return entityType;
    }

    public Object getFromState() {
        return fromState;
    }

    public Object getToState() {
        return toState;
    }
}
