package com.ledgerbook.finance.services.reports;

import java.util.Objects;

import com.ledgerbook.finance.money.Money;

/** Total of one category over the whole reporting period. */
public record CategoryAmount(String category, Money amount) {

    public CategoryAmount {
        Objects.requireNonNull(amount, "amount");
        category = category == null ? "" : category;
    }

    public static CategoryAmount of(String category, long amount, String currency) {
        return new CategoryAmount(category, Money.of(amount, currency));
    }
}
