package com.ledgerbook.finance.services.reports;

import com.ledgerbook.finance.money.Money;

public record IncomeStatement(DateRange period, Statement statement) {

    public Money totalRevenue() {
        return statement.inflow().subtotal();
    }

    public Money totalExpenses() {
        return statement.outflow().subtotal();
    }

    public Money netProfit() {
        return statement.netResult();
    }
}
