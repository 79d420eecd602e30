package com.ledgerbook.finance.services.reports;

import java.util.UUID;

import com.ledgerbook.finance.money.Money;

/**
 * Cashflow of one money account (or of all accounts when {@code accountId} is null).
 * The ending balance is the current account balance; the starting balance is
 * derived from it so that {@code startingBalance + netCashFlow == endingBalance}.
 */
public record CashflowStatement(
        UUID accountId,
        String accountName,
        DateRange period,
        Statement statement,
        Money startingBalance,
        Money endingBalance
) {

    public Money netCashFlow() {
        return statement.netResult();
    }

    public Money totalInflows() {
        return statement.inflow().subtotal();
    }

    public Money totalOutflows() {
        return statement.outflow().subtotal();
    }
}
