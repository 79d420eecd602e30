package com.ledgerbook.finance.services.reports;

import com.ledgerbook.finance.money.Money;

/**
 * Aggregated two-sided report: revenue against expenses, or inflows against
 * outflows. {@code netResult} is the inflow subtotal minus the outflow subtotal.
 */
public record Statement(
        StatementKind kind,
        Section inflow,
        Section outflow,
        Money netResult,
        MonthlyBreakdown monthly
) {

    public String currency() {
        return netResult.currency();
    }

    /** Strictly positive net result. Break-even (zero) is not a profit. */
    public boolean isProfit() {
        return netResult.isPositive();
    }

    public boolean isPositive() {
        return isProfit();
    }

    public boolean isBreakEven() {
        return netResult.isZero();
    }

    public boolean hasMonthlyBreakdown() {
        return monthly != null;
    }
}
