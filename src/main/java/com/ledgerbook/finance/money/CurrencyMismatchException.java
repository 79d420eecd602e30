package com.ledgerbook.finance.money;

/**
 * Thrown when amounts of different currencies are combined.
 */
public class CurrencyMismatchException extends RuntimeException {

    private final String expected;
    private final String actual;

    public CurrencyMismatchException(String expected, String actual) {
        super("Currency mismatch: expected " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
