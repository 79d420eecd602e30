package com.ledgerbook.finance.repositories.query;

import java.util.List;
import java.util.UUID;

import com.ledgerbook.finance.services.reports.CategoryAmount;
import com.ledgerbook.finance.services.reports.DateRange;
import com.ledgerbook.finance.services.reports.MonthlyCategoryAmount;

/**
 * Per-category totals of payments (income, inflows) and expenses (outflows)
 * by accounting period. Amounts are in minor units of the account currency;
 * rows are split per currency, never converted.
 */
public interface FinancialReportsQueryRepository {

    List<CategoryAmount> getIncomeByCategory(DateRange range);

    List<CategoryAmount> getExpensesByCategory(DateRange range);

    List<MonthlyCategoryAmount> getMonthlyIncomeByCategory(DateRange range);

    List<MonthlyCategoryAmount> getMonthlyExpensesByCategory(DateRange range);

    /**
     * @param accountId money account to restrict to, {@code null} for all accounts
     */
    CashflowRows getCashflowByCategory(DateRange range, UUID accountId);

    /**
     * @param accountId money account to restrict to, {@code null} for all accounts
     */
    MonthlyCashflowRows getMonthlyCashflowByCategory(DateRange range, UUID accountId);
}
