package com.ledgerbook.finance.services.reports;

import java.time.YearMonth;
import java.util.Objects;

import com.ledgerbook.finance.money.Money;

/** Total of one category within one calendar month. */
public record MonthlyCategoryAmount(YearMonth month, String category, Money amount) {

    public MonthlyCategoryAmount {
        Objects.requireNonNull(month, "month");
        Objects.requireNonNull(amount, "amount");
        category = category == null ? "" : category;
    }

    public static MonthlyCategoryAmount of(YearMonth month, String category, long amount, String currency) {
        return new MonthlyCategoryAmount(month, category, Money.of(amount, currency));
    }
}
