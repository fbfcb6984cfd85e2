package io.coko.billing.exception;

import io.coko.billing.money.CurrencyCode;

public class CurrencyMismatchException extends ValidationException {

    private final CurrencyCode expected;
    private final CurrencyCode actual;

    public CurrencyMismatchException(CurrencyCode expected, CurrencyCode actual) {
        super("Currency mismatch: expected " + expected + " but got " + actual, "currency", actual);
        this.expected = expected;
        this.actual = actual;
    }

    public CurrencyCode getExpected() {
        return expected;
    }

    public CurrencyCode getActual() {
        return actual;
    }
}
