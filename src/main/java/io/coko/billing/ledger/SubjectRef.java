package io.coko.billing.ledger;

import io.coko.billing.exception.ValidationException;

import java.util.Objects;
import java.util.UUID;

/**
 * What a transaction pays for. Serialized as {@code invoice:<uuid>} or
 * {@code subscription:<uuid>}; this is also the reference string sent to providers
 * so their notifications can be routed back.
 */
public final class SubjectRef {

    public enum Type {
        INVOICE("invoice"),
        SUBSCRIPTION("subscription");

        private final String prefix;

        Type(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }
    }

    private final Type type;
    private final UUID id;

    private SubjectRef(Type type, UUID id) {
        this.type = Objects.requireNonNull(type, "type");
        this.id = Objects.requireNonNull(id, "id");
    }

    public static SubjectRef invoice(UUID invoiceId) {
        return new SubjectRef(Type.INVOICE, invoiceId);
    }

    public static SubjectRef subscription(UUID subscriptionId) {
        return new SubjectRef(Type.SUBSCRIPTION, subscriptionId);
    }

    public static SubjectRef parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Subject reference is required", "subjectRef", value);
        }
        int separator = value.indexOf(':');
        if (separator < 0) {
            throw new ValidationException("Malformed subject reference: " + value, "subjectRef", value);
        }
        String prefix = value.substring(0, separator).trim();
        String id = value.substring(separator + 1).trim();
        for (Type type : Type.values()) {
            if (type.prefix.equalsIgnoreCase(prefix)) {
                try {
                    return new SubjectRef(type, UUID.fromString(id));
                } catch (IllegalArgumentException e) {
                    throw new ValidationException("Malformed subject id: " + value, e);
                }
            }
        }
        throw new ValidationException("Unknown subject type: " + value, "subjectRef", value);
    }

    public Type getType() {
        return type;
    }

    public UUID getId() {
        return id;
    }

    public boolean isInvoice() {
        return type == Type.INVOICE;
    }

    public boolean isSubscription() {
        return type == Type.SUBSCRIPTION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubjectRef)) {
            return false;
        }
        SubjectRef that = (SubjectRef) o;
        return type == that.type && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, id);
    }

    @Override
    public String toString() {
        return type.prefix + ":" + id;
    }
}
