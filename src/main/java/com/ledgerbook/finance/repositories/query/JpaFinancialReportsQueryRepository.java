package com.ledgerbook.finance.repositories.query;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.ledgerbook.finance.config.ReportsProperties;
import com.ledgerbook.finance.money.Money;
import com.ledgerbook.finance.services.reports.CategoryAmount;
import com.ledgerbook.finance.services.reports.DateRange;
import com.ledgerbook.finance.services.reports.MonthlyCategoryAmount;

import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import lombok.RequiredArgsConstructor;

@Repository
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class JpaFinancialReportsQueryRepository implements FinancialReportsQueryRepository {

    private static final String INCOME_BY_CATEGORY =
            "select pc.name, sum(p.amount), a.currency "
                    + "from Payment p join p.account a left join p.category pc "
                    + "where p.accountingPeriod >= :startDate and p.accountingPeriod <= :endDate ";

    private static final String INCOME_GROUP =
            "group by pc.name, a.currency order by pc.name";

    private static final String EXPENSES_BY_CATEGORY =
            "select ec.name, sum(e.amount), a.currency "
                    + "from Expense e join e.account a join e.category ec "
                    + "where e.accountingPeriod >= :startDate and e.accountingPeriod <= :endDate ";

    private static final String EXPENSES_GROUP =
            "group by ec.name, a.currency order by ec.name";

    private static final String MONTHLY_INCOME_BY_CATEGORY =
            "select pc.name, year(p.accountingPeriod), month(p.accountingPeriod), sum(p.amount), a.currency "
                    + "from Payment p join p.account a left join p.category pc "
                    + "where p.accountingPeriod >= :startDate and p.accountingPeriod <= :endDate ";

    private static final String MONTHLY_INCOME_GROUP =
            "group by pc.name, year(p.accountingPeriod), month(p.accountingPeriod), a.currency "
                    + "order by pc.name, year(p.accountingPeriod), month(p.accountingPeriod)";

    private static final String MONTHLY_EXPENSES_BY_CATEGORY =
            "select ec.name, year(e.accountingPeriod), month(e.accountingPeriod), sum(e.amount), a.currency "
                    + "from Expense e join e.account a join e.category ec "
                    + "where e.accountingPeriod >= :startDate and e.accountingPeriod <= :endDate ";

    private static final String MONTHLY_EXPENSES_GROUP =
            "group by ec.name, year(e.accountingPeriod), month(e.accountingPeriod), a.currency "
                    + "order by ec.name, year(e.accountingPeriod), month(e.accountingPeriod)";

    private static final String ACCOUNT_FILTER = "and a.id = :accountId ";

    private final EntityManager entityManager;
    private final ReportsProperties reportsProperties;

    @Override
    public List<CategoryAmount> getIncomeByCategory(DateRange range) {
        return categoryTotals(INCOME_BY_CATEGORY, INCOME_GROUP, range, null);
    }

    @Override
    public List<CategoryAmount> getExpensesByCategory(DateRange range) {
        return categoryTotals(EXPENSES_BY_CATEGORY, EXPENSES_GROUP, range, null);
    }

    @Override
    public List<MonthlyCategoryAmount> getMonthlyIncomeByCategory(DateRange range) {
        return monthlyTotals(MONTHLY_INCOME_BY_CATEGORY, MONTHLY_INCOME_GROUP, range, null);
    }

    @Override
    public List<MonthlyCategoryAmount> getMonthlyExpensesByCategory(DateRange range) {
        return monthlyTotals(MONTHLY_EXPENSES_BY_CATEGORY, MONTHLY_EXPENSES_GROUP, range, null);
    }

    @Override
    public CashflowRows getCashflowByCategory(DateRange range, UUID accountId) {
        return new CashflowRows(
                categoryTotals(INCOME_BY_CATEGORY, INCOME_GROUP, range, accountId),
                categoryTotals(EXPENSES_BY_CATEGORY, EXPENSES_GROUP, range, accountId)
        );
    }

    @Override
    public MonthlyCashflowRows getMonthlyCashflowByCategory(DateRange range, UUID accountId) {
        return new MonthlyCashflowRows(
                monthlyTotals(MONTHLY_INCOME_BY_CATEGORY, MONTHLY_INCOME_GROUP, range, accountId),
                monthlyTotals(MONTHLY_EXPENSES_BY_CATEGORY, MONTHLY_EXPENSES_GROUP, range, accountId)
        );
    }

    // row: category, amount, currency
    private List<CategoryAmount> categoryTotals(String select, String group, DateRange range, UUID accountId) {
        List<Object[]> rows = query(select, group, range, accountId).getResultList();

        List<CategoryAmount> out = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            out.add(new CategoryAmount(
                    categoryName(row[0]),
                    Money.of(toLong(row[1]), currency(row[2]))
            ));
        }
        return out;
    }

    // row: category, year, month, amount, currency
    private List<MonthlyCategoryAmount> monthlyTotals(String select, String group, DateRange range, UUID accountId) {
        List<Object[]> rows = query(select, group, range, accountId).getResultList();

        List<MonthlyCategoryAmount> out = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            YearMonth month = YearMonth.of((int) toLong(row[1]), (int) toLong(row[2]));
            out.add(new MonthlyCategoryAmount(
                    month,
                    categoryName(row[0]),
                    Money.of(toLong(row[3]), currency(row[4]))
            ));
        }
        return out;
    }

    private TypedQuery<Object[]> query(String select, String group, DateRange range, UUID accountId) {
        String jpql = accountId == null ? select + group : select + ACCOUNT_FILTER + group;

        TypedQuery<Object[]> query = entityManager.createQuery(jpql, Object[].class)
                .setParameter("startDate", range.start())
                .setParameter("endDate", range.end());
        if (accountId != null) {
            query.setParameter("accountId", accountId);
        }
        return query;
    }

    private String categoryName(Object value) {
        return value == null ? reportsProperties.uncategorizedLabel() : value.toString();
    }

    private String currency(Object value) {
        return value == null ? reportsProperties.defaultCurrency() : value.toString();
    }

    private static long toLong(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }
}
