package com.ledgerbook.finance.services;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ledgerbook.finance.config.ReportsProperties;
import com.ledgerbook.finance.dto.reports.CashflowStatementResponseDTO;
import com.ledgerbook.finance.dto.reports.IncomeStatementResponseDTO;
import com.ledgerbook.finance.entities.MoneyAccount;
import com.ledgerbook.finance.money.CurrencyMismatchException;
import com.ledgerbook.finance.money.Money;
import com.ledgerbook.finance.repositories.query.CashflowRows;
import com.ledgerbook.finance.repositories.query.FinancialReportsQueryRepository;
import com.ledgerbook.finance.repositories.query.MonthlyCashflowRows;
import com.ledgerbook.finance.services.reports.CashflowStatement;
import com.ledgerbook.finance.services.reports.CategoryAmount;
import com.ledgerbook.finance.services.reports.DateRange;
import com.ledgerbook.finance.services.reports.IncomeStatement;
import com.ledgerbook.finance.services.reports.Statement;
import com.ledgerbook.finance.services.reports.StatementAggregator;
import com.ledgerbook.finance.services.reports.StatementFormatter;
import com.ledgerbook.finance.services.reports.StatementKind;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Income and cashflow statements over an accounting period.
 * <p>
 * The report variants first read the flat category totals (a failure there
 * propagates), then try the month-by-month totals and fall back to the flat
 * view when that second read or its aggregation fails. They hold no
 * transaction of their own: every read runs in the query repository's
 * read-only transaction, so a failed monthly read rolls back alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FinancialReportService {

    public static final String ALL_ACCOUNTS = "All Accounts";

    private final FinancialReportsQueryRepository queryRepository;
    private final MoneyAccountService moneyAccountService;
    private final StatementAggregator statementAggregator;
    private final StatementFormatter statementFormatter;
    private final ReportsProperties reportsProperties;

    @Transactional(readOnly = true)
    public IncomeStatement generateIncomeStatement(DateRange range) {
        List<CategoryAmount> income = queryRepository.getIncomeByCategory(range);
        List<CategoryAmount> expenses = queryRepository.getExpensesByCategory(range);
        return new IncomeStatement(range, statementAggregator.build(StatementKind.INCOME_STATEMENT, income, expenses));
    }

    public IncomeStatementResponseDTO incomeStatementReport(DateRange range) {
        List<CategoryAmount> income = queryRepository.getIncomeByCategory(range);
        List<CategoryAmount> expenses = queryRepository.getExpensesByCategory(range);

        Statement statement = withMonthlyFallback(
                "income-statement",
                range,
                () -> statementAggregator.build(
                        StatementKind.INCOME_STATEMENT,
                        income,
                        expenses,
                        queryRepository.getMonthlyIncomeByCategory(range),
                        queryRepository.getMonthlyExpensesByCategory(range)),
                () -> statementAggregator.build(StatementKind.INCOME_STATEMENT, income, expenses)
        );

        return toResponseDTO(new IncomeStatement(range, statement));
    }

    @Transactional(readOnly = true)
    public CashflowStatement generateCashflowStatement(UUID accountId, DateRange range) {
        AccountScope scope = resolveScope(accountId);
        CashflowRows rows = queryRepository.getCashflowByCategory(range, accountId);
        Statement statement = scope.aggregator(statementAggregator)
                .build(StatementKind.CASHFLOW, rows.inflows(), rows.outflows());
        return toCashflowStatement(scope, range, statement);
    }

    public CashflowStatementResponseDTO cashflowStatementReport(UUID accountId, DateRange range) {
        AccountScope scope = resolveScope(accountId);
        StatementAggregator aggregator = scope.aggregator(statementAggregator);
        CashflowRows rows = queryRepository.getCashflowByCategory(range, accountId);

        Statement statement = withMonthlyFallback(
                "cashflow",
                range,
                () -> {
                    MonthlyCashflowRows monthly = queryRepository.getMonthlyCashflowByCategory(range, accountId);
                    return aggregator.build(
                            StatementKind.CASHFLOW,
                            rows.inflows(),
                            rows.outflows(),
                            monthly.inflows(),
                            monthly.outflows());
                },
                () -> aggregator.build(StatementKind.CASHFLOW, rows.inflows(), rows.outflows())
        );

        return toResponseDTO(toCashflowStatement(scope, range, statement));
    }

    public IncomeStatementResponseDTO toResponseDTO(IncomeStatement incomeStatement) {
        DateRange period = incomeStatement.period();
        return IncomeStatementResponseDTO.builder()
                .title("Income Statement " + period.start() + " to " + period.end())
                .startDate(period.start())
                .endDate(period.end())
                .statement(statementFormatter.format(incomeStatement.statement()))
                .build();
    }

    public CashflowStatementResponseDTO toResponseDTO(CashflowStatement cashflow) {
        DateRange period = cashflow.period();
        return CashflowStatementResponseDTO.builder()
                .title("Cashflow Statement " + period.start() + " to " + period.end())
                .accountId(cashflow.accountId())
                .accountName(cashflow.accountName())
                .startDate(period.start())
                .endDate(period.end())
                .startingBalance(cashflow.startingBalance().amount())
                .startingBalanceFormatted(statementFormatter.formatMoney(cashflow.startingBalance()))
                .endingBalance(cashflow.endingBalance().amount())
                .endingBalanceFormatted(statementFormatter.formatMoney(cashflow.endingBalance()))
                .statement(statementFormatter.format(cashflow.statement()))
                .build();
    }

    private Statement withMonthlyFallback(
            String report,
            DateRange range,
            Supplier<Statement> monthly,
            Supplier<Statement> flat
    ) {
        try {
            return monthly.get();
        } catch (DataAccessException | CurrencyMismatchException ex) {
            log.warn("[FinancialReportService] {} monthly breakdown unavailable for {} -> {}, using flat view: {}",
                    report, range.start(), range.end(), ex.getMessage());
            return flat.get();
        }
    }

    private AccountScope resolveScope(UUID accountId) {
        if (accountId != null) {
            MoneyAccount account = moneyAccountService.getById(accountId);
            return new AccountScope(account.getId(), account.getName(), account.balanceAsMoney());
        }

        List<MoneyAccount> accounts = moneyAccountService.getAll();
        if (accounts.isEmpty()) {
            return new AccountScope(null, ALL_ACCOUNTS, Money.zero(reportsProperties.defaultCurrency()));
        }
        Money total = Money.zero(accounts.get(0).getCurrency());
        for (MoneyAccount account : accounts) {
            total = total.add(account.balanceAsMoney());
        }
        return new AccountScope(null, ALL_ACCOUNTS, total);
    }

    private static CashflowStatement toCashflowStatement(AccountScope scope, DateRange range, Statement statement) {
        Money ending = scope.balance();
        Money starting = ending.subtract(statement.netResult());
        return new CashflowStatement(scope.id(), scope.name(), range, statement, starting, ending);
    }

    private record AccountScope(UUID id, String name, Money balance) {

        // an account without activity still reports in its own currency
        StatementAggregator aggregator(StatementAggregator base) {
            return base.withDefaultCurrency(balance.currency());
        }
    }
}
