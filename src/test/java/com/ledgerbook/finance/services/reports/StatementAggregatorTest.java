package com.ledgerbook.finance.services.reports;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ledgerbook.finance.exceptions.InvalidDateRangeException;
import com.ledgerbook.finance.money.CurrencyMismatchException;
import com.ledgerbook.finance.money.Money;

class StatementAggregatorTest {

    private static final YearMonth JAN = YearMonth.of(2024, 1);
    private static final YearMonth FEB = YearMonth.of(2024, 2);

    private final StatementAggregator aggregator = new StatementAggregator("USD");

    @Test
    @DisplayName("income statement: percentages, subtotals, net profit")
    void build_incomeStatement_computesSectionsAndNet() {
        Statement statement = aggregator.build(
                StatementKind.INCOME_STATEMENT,
                List.of(CategoryAmount.of("Sales", 10000, "USD"), CategoryAmount.of("Services", 5000, "USD")),
                List.of(CategoryAmount.of("Rent", 6000, "USD"))
        );

        Section revenue = statement.inflow();
        assertEquals("Revenue", revenue.title());
        assertEquals(Money.of(15000, "USD"), revenue.subtotal());
        assertEquals("Sales", revenue.items().get(0).category());
        assertEquals(new BigDecimal("66.67"), revenue.items().get(0).percentage());
        assertEquals("Services", revenue.items().get(1).category());
        assertEquals(new BigDecimal("33.33"), revenue.items().get(1).percentage());

        Section expenses = statement.outflow();
        assertEquals("Expenses", expenses.title());
        assertEquals(new BigDecimal("100.00"), expenses.items().get(0).percentage());

        assertEquals(Money.of(9000, "USD"), statement.netResult());
        assertTrue(statement.isProfit());
        assertFalse(statement.isBreakEven());
        assertFalse(statement.hasMonthlyBreakdown());
        assertNull(statement.monthly());
    }

    @Test
    void build_noInflows_givesEmptySectionAndNegativeNet() {
        Statement statement = aggregator.build(
                StatementKind.INCOME_STATEMENT,
                List.of(),
                List.of(CategoryAmount.of("Rent", 6000, "USD"))
        );

        assertTrue(statement.inflow().isEmpty());
        assertEquals(Money.zero("USD"), statement.inflow().subtotal());
        assertEquals(Money.of(-6000, "USD"), statement.netResult());
        assertFalse(statement.isProfit());
    }

    @Test
    void build_noRowsAtAll_usesDefaultCurrency() {
        Statement statement = aggregator.withDefaultCurrency("EUR")
                .build(StatementKind.CASHFLOW, List.of(), List.of());

        assertEquals("EUR", statement.currency());
        assertTrue(statement.isBreakEven());
        assertEquals("Inflows", statement.inflow().title());
        assertEquals("Outflows", statement.outflow().title());
    }

    @Test
    void build_nullRowLists_treatedAsEmpty() {
        Statement statement = aggregator.build(StatementKind.INCOME_STATEMENT, null, null);

        assertTrue(statement.inflow().isEmpty());
        assertTrue(statement.outflow().isEmpty());
        assertEquals("USD", statement.currency());
    }

    @Test
    void build_mixedCurrencies_throwsCurrencyMismatch() {
        assertThrows(CurrencyMismatchException.class, () -> aggregator.build(
                StatementKind.INCOME_STATEMENT,
                List.of(CategoryAmount.of("Sales", 10000, "USD")),
                List.of(CategoryAmount.of("Rent", 6000, "EUR"))
        ));
    }

    @Test
    void build_monthlyRowsInOtherCurrency_throwsCurrencyMismatch() {
        assertThrows(CurrencyMismatchException.class, () -> aggregator.build(
                StatementKind.INCOME_STATEMENT,
                List.of(CategoryAmount.of("Sales", 10000, "USD")),
                List.of(),
                List.of(MonthlyCategoryAmount.of(JAN, "Sales", 10000, "EUR")),
                List.of()
        ));
    }

    @Test
    void build_equalTotals_isBreakEvenNotProfit() {
        Statement statement = aggregator.build(
                StatementKind.INCOME_STATEMENT,
                List.of(CategoryAmount.of("Sales", 5000, "USD")),
                List.of(CategoryAmount.of("Rent", 5000, "USD"))
        );

        assertTrue(statement.isBreakEven());
        assertFalse(statement.isProfit());
        assertTrue(statement.netResult().isZero());
    }

    @Test
    void build_equalAmounts_orderedByCategoryName() {
        Statement statement = aggregator.build(
                StatementKind.INCOME_STATEMENT,
                List.of(
                        CategoryAmount.of("Zeta", 1000, "USD"),
                        CategoryAmount.of("Alpha", 1000, "USD"),
                        CategoryAmount.of("Big", 3000, "USD")
                ),
                List.of()
        );

        List<LineItem> items = statement.inflow().items();
        assertEquals("Big", items.get(0).category());
        assertEquals("Alpha", items.get(1).category());
        assertEquals("Zeta", items.get(2).category());
    }

    @Test
    void build_percentagesSumToHundredWithinRounding() {
        Statement statement = aggregator.build(
                StatementKind.INCOME_STATEMENT,
                List.of(
                        CategoryAmount.of("A", 1, "USD"),
                        CategoryAmount.of("B", 1, "USD"),
                        CategoryAmount.of("C", 1, "USD")
                ),
                List.of()
        );

        BigDecimal sum = statement.inflow().items().stream()
                .map(LineItem::percentage)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertTrue(sum.subtract(new BigDecimal("100")).abs().compareTo(new BigDecimal("0.1")) <= 0);
    }

    @Test
    void build_subtotalEqualsSumOfItems() {
        Statement statement = aggregator.build(
                StatementKind.CASHFLOW,
                List.of(CategoryAmount.of("A", 1234, "USD"), CategoryAmount.of("B", 4321, "USD")),
                List.of(CategoryAmount.of("C", 999, "USD"))
        );

        long itemSum = statement.inflow().items().stream().mapToLong(i -> i.amount().amount()).sum();
        assertEquals(itemSum, statement.inflow().subtotal().amount());
        assertEquals(5555 - 999, statement.netResult().amount());
    }

    @Test
    void build_zeroSubtotal_givesZeroPercentages() {
        Statement statement = aggregator.build(
                StatementKind.INCOME_STATEMENT,
                List.of(CategoryAmount.of("Refunds", 0, "USD")),
                List.of()
        );

        assertEquals(new BigDecimal("0.00"), statement.inflow().items().get(0).percentage());
    }

    @Test
    void build_duplicateCategoryRows_areMerged() {
        Statement statement = aggregator.build(
                StatementKind.INCOME_STATEMENT,
                List.of(CategoryAmount.of("Sales", 1000, "USD"), CategoryAmount.of("Sales", 500, "USD")),
                List.of()
        );

        assertEquals(1, statement.inflow().items().size());
        assertEquals(Money.of(1500, "USD"), statement.inflow().items().get(0).amount());
    }

    @Test
    void build_withMonthlyRows_buildsSortedMonthGrid() {
        Statement statement = aggregator.build(
                StatementKind.INCOME_STATEMENT,
                List.of(CategoryAmount.of("Sales", 3000, "USD")),
                List.of(CategoryAmount.of("Rent", 2000, "USD")),
                List.of(
                        MonthlyCategoryAmount.of(FEB, "Sales", 2000, "USD"),
                        MonthlyCategoryAmount.of(JAN, "Sales", 1000, "USD")
                ),
                List.of(MonthlyCategoryAmount.of(FEB, "Rent", 2000, "USD"))
        );

        assertTrue(statement.hasMonthlyBreakdown());
        MonthlyBreakdown monthly = statement.monthly();
        assertEquals(List.of(JAN, FEB), monthly.months());
        assertEquals(Map.of("Sales", Money.of(1000, "USD")), monthly.inflows().get(JAN));
        assertEquals(Money.of(2000, "USD"), monthly.outflows().get(FEB).get("Rent"));
        assertNull(monthly.outflows().get(JAN));
    }

    @Test
    void build_emptyMonthlyRows_stillAttachesEmptyBreakdown() {
        Statement statement = aggregator.build(
                StatementKind.INCOME_STATEMENT,
                List.of(),
                List.of(),
                List.of(),
                List.of()
        );

        assertTrue(statement.hasMonthlyBreakdown());
        assertTrue(statement.monthly().isEmpty());
    }

    @Test
    @DisplayName("category present only in monthly rows is added to the flat section")
    void build_monthlyOnlyCategory_isMergedIntoSection() {
        Statement statement = aggregator.build(
                StatementKind.INCOME_STATEMENT,
                List.of(CategoryAmount.of("Sales", 3000, "USD")),
                List.of(),
                List.of(
                        MonthlyCategoryAmount.of(JAN, "Sales", 3000, "USD"),
                        MonthlyCategoryAmount.of(JAN, "Consulting", 400, "USD"),
                        MonthlyCategoryAmount.of(FEB, "Consulting", 600, "USD")
                ),
                List.of()
        );

        List<LineItem> items = statement.inflow().items();
        assertEquals(2, items.size());
        LineItem consulting = items.get(1);
        assertEquals("Consulting", consulting.category());
        assertEquals(Money.of(1000, "USD"), consulting.amount());
        assertEquals(Money.of(4000, "USD"), statement.inflow().subtotal());
        assertEquals(new BigDecimal("25.00"), consulting.percentage());
    }

    @Test
    void build_flatTotalWins_whenCategoryInBothReads() {
        Statement statement = aggregator.build(
                StatementKind.INCOME_STATEMENT,
                List.of(CategoryAmount.of("Sales", 3000, "USD")),
                List.of(),
                List.of(MonthlyCategoryAmount.of(JAN, "Sales", 2500, "USD")),
                List.of()
        );

        assertEquals(Money.of(3000, "USD"), statement.inflow().subtotal());
        assertNotNull(statement.monthly());
    }

    @Test
    void dateRange_endBeforeStart_isRejected() {
        assertThrows(InvalidDateRangeException.class,
                () -> DateRange.of(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1)));
    }
}
