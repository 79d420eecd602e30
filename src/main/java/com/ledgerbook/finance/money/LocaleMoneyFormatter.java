package com.ledgerbook.finance.money;

import java.text.NumberFormat;
import java.util.Currency;
import java.util.Locale;
import java.util.Objects;

/**
 * Formats amounts with the JDK currency format of a fixed locale,
 * e.g. {@code 150000 USD -> "$1,500.00"} for {@code en-US}.
 */
public class LocaleMoneyFormatter implements MoneyFormatter {

    private final Locale locale;

    public LocaleMoneyFormatter(Locale locale) {
        this.locale = Objects.requireNonNull(locale, "locale");
    }

    @Override
    public String format(Money money) {
        if (money == null) return "";

        // NumberFormat is not thread-safe, one instance per call
        NumberFormat nf = NumberFormat.getCurrencyInstance(locale);
        int digits = money.fractionDigits();
        try {
            nf.setCurrency(Currency.getInstance(money.currency()));
        } catch (IllegalArgumentException ex) {
            NumberFormat plain = NumberFormat.getNumberInstance(locale);
            plain.setMinimumFractionDigits(digits);
            plain.setMaximumFractionDigits(digits);
            return plain.format(money.toMajorUnits()) + " " + money.currency();
        }
        nf.setMinimumFractionDigits(digits);
        nf.setMaximumFractionDigits(digits);
        return nf.format(money.toMajorUnits());
    }
}
