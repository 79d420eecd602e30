package com.ledgerbook.finance.services.reports;

import java.util.List;

import com.ledgerbook.finance.money.Money;

/**
 * One side of a statement. {@code subtotal} always equals the sum of the item amounts.
 */
public record Section(String title, List<LineItem> items, Money subtotal) {

    public Section {
        items = List.copyOf(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
