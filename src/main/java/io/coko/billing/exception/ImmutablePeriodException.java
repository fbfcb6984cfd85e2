package io.coko.billing.exception;

import io.coko.billing.royalty.RoyaltyPeriod;

public class ImmutablePeriodException extends BillingException {

    private final RoyaltyPeriod period;

    public ImmutablePeriodException(RoyaltyPeriod period, String message) {
        super("conflict", message);
        this.period = period;
    }

    public RoyaltyPeriod getPeriod() {
        return period;
    }
}
