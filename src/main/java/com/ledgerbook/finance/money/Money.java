package com.ledgerbook.finance.money;

import java.math.BigDecimal;
import java.util.Currency;
import java.util.Locale;
import java.util.Objects;

/**
 * Amount of money held as an integer number of minor units (cents for USD)
 * together with its ISO-4217 currency code.
 * <p>
 * Arithmetic is only defined between amounts of the same currency; mixing
 * currencies throws {@link CurrencyMismatchException}.
 */
public record Money(long amount, String currency) {

    public Money {
        Objects.requireNonNull(currency, "currency");
        currency = currency.trim().toUpperCase(Locale.ROOT);
        if (currency.isEmpty()) {
            throw new IllegalArgumentException("currency must not be blank");
        }
    }

    public static Money of(long amount, String currency) {
        return new Money(amount, currency);
    }

    public static Money zero(String currency) {
        return new Money(0L, currency);
    }

    public Money add(Money other) {
        requireSameCurrency(other);
        return new Money(Math.addExact(amount, other.amount), currency);
    }

    public Money subtract(Money other) {
        requireSameCurrency(other);
        return new Money(Math.subtractExact(amount, other.amount), currency);
    }

    public boolean isPositive() {
        return amount > 0;
    }

    public boolean isNegative() {
        return amount < 0;
    }

    public boolean isZero() {
        return amount == 0;
    }

    /**
     * Major-unit value, e.g. {@code 12345 USD -> 123.45}. Unknown currency
     * codes are treated as having two fraction digits.
     */
    public BigDecimal toMajorUnits() {
        return BigDecimal.valueOf(amount).movePointLeft(fractionDigits());
    }

    int fractionDigits() {
        try {
            int digits = Currency.getInstance(currency).getDefaultFractionDigits();
            return digits < 0 ? 2 : digits;
        } catch (IllegalArgumentException ex) {
            return 2;
        }
    }

    private void requireSameCurrency(Money other) {
        Objects.requireNonNull(other, "other");
        if (!currency.equals(other.currency)) {
            throw new CurrencyMismatchException(currency, other.currency);
        }
    }

    @Override
    public String toString() {
        return amount + " " + currency;
    }
}
