package com.ledgerbook.finance.services.reports;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.ledgerbook.finance.money.CurrencyMismatchException;
import com.ledgerbook.finance.money.Money;

/**
 * Builds a {@link Statement} from per-category query rows.
 * <p>
 * Line items are ordered by amount descending, then by category name.
 * Percentages are rounded half-up to two decimals and are zero when the
 * section subtotal is zero. When month-bucketed rows are supplied a month
 * grid is attached, and a category that only shows up in the monthly rows
 * is added to the flat section with its monthly total, since the flat and
 * monthly totals come from two independent queries.
 * <p>
 * Stateless and side-effect free; safe to share between threads.
 */
public class StatementAggregator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final Comparator<LineItem> LINE_ITEM_ORDER = Comparator
            .comparingLong((LineItem item) -> item.amount().amount())
            .reversed()
            .thenComparing(LineItem::category);

    private final String defaultCurrency;

    public StatementAggregator(String defaultCurrency) {
        this.defaultCurrency = Money.zero(Objects.requireNonNull(defaultCurrency, "defaultCurrency")).currency();
    }

    public String defaultCurrency() {
        return defaultCurrency;
    }

    /** Same rules, different currency for statements built from no rows at all. */
    public StatementAggregator withDefaultCurrency(String currency) {
        return new StatementAggregator(currency);
    }

    /** Flat view, no month breakdown. */
    public Statement build(StatementKind kind, List<CategoryAmount> inflowRows, List<CategoryAmount> outflowRows) {
        return build(kind, inflowRows, outflowRows, null, null);
    }

    /**
     * @param monthlyInflowRows  month-bucketed inflow rows, or {@code null} together with
     *                           {@code monthlyOutflowRows} for the flat view
     * @throws CurrencyMismatchException if the rows are not all in one currency
     */
    public Statement build(
            StatementKind kind,
            List<CategoryAmount> inflowRows,
            List<CategoryAmount> outflowRows,
            List<MonthlyCategoryAmount> monthlyInflowRows,
            List<MonthlyCategoryAmount> monthlyOutflowRows
    ) {
        Objects.requireNonNull(kind, "kind");
        List<CategoryAmount> inflows = orEmpty(inflowRows);
        List<CategoryAmount> outflows = orEmpty(outflowRows);
        boolean withMonthly = monthlyInflowRows != null || monthlyOutflowRows != null;
        List<MonthlyCategoryAmount> monthlyInflows = orEmpty(monthlyInflowRows);
        List<MonthlyCategoryAmount> monthlyOutflows = orEmpty(monthlyOutflowRows);

        String currency = resolveCurrency(inflows, outflows, monthlyInflows, monthlyOutflows);

        Map<String, Money> inflowTotals = totalsByCategory(inflows);
        Map<String, Money> outflowTotals = totalsByCategory(outflows);

        MonthlyBreakdown breakdown = null;
        if (withMonthly) {
            mergeMonthlyOnlyCategories(inflowTotals, monthlyInflows);
            mergeMonthlyOnlyCategories(outflowTotals, monthlyOutflows);
            breakdown = new MonthlyBreakdown(grid(monthlyInflows), grid(monthlyOutflows));
        }

        Section inflow = section(kind.inflowTitle(), inflowTotals, currency);
        Section outflow = section(kind.outflowTitle(), outflowTotals, currency);
        Money net = inflow.subtotal().subtract(outflow.subtotal());

        return new Statement(kind, inflow, outflow, net, breakdown);
    }

    private String resolveCurrency(
            List<CategoryAmount> inflows,
            List<CategoryAmount> outflows,
            List<MonthlyCategoryAmount> monthlyInflows,
            List<MonthlyCategoryAmount> monthlyOutflows
    ) {
        String currency = null;
        currency = checkCurrencies(currency, inflows.stream().map(CategoryAmount::amount).toList());
        currency = checkCurrencies(currency, outflows.stream().map(CategoryAmount::amount).toList());
        currency = checkCurrencies(currency, monthlyInflows.stream().map(MonthlyCategoryAmount::amount).toList());
        currency = checkCurrencies(currency, monthlyOutflows.stream().map(MonthlyCategoryAmount::amount).toList());
        return currency == null ? defaultCurrency : currency;
    }

    private static String checkCurrencies(String expected, Collection<Money> amounts) {
        String current = expected;
        for (Money amount : amounts) {
            if (current == null) {
                current = amount.currency();
            } else if (!current.equals(amount.currency())) {
                throw new CurrencyMismatchException(current, amount.currency());
            }
        }
        return current;
    }

    private static Map<String, Money> totalsByCategory(List<CategoryAmount> rows) {
        Map<String, Money> totals = new LinkedHashMap<>();
        for (CategoryAmount row : rows) {
            totals.merge(row.category(), row.amount(), Money::add);
        }
        return totals;
    }

    private static void mergeMonthlyOnlyCategories(Map<String, Money> flatTotals, List<MonthlyCategoryAmount> monthlyRows) {
        Map<String, Money> monthlyTotals = new LinkedHashMap<>();
        for (MonthlyCategoryAmount row : monthlyRows) {
            if (flatTotals.containsKey(row.category())) continue;
            monthlyTotals.merge(row.category(), row.amount(), Money::add);
        }
        flatTotals.putAll(monthlyTotals);
    }

    private static Map<YearMonth, Map<String, Money>> grid(List<MonthlyCategoryAmount> rows) {
        Map<YearMonth, Map<String, Money>> grid = new TreeMap<>();
        for (MonthlyCategoryAmount row : rows) {
            grid.computeIfAbsent(row.month(), m -> new LinkedHashMap<>())
                    .merge(row.category(), row.amount(), Money::add);
        }
        return grid;
    }

    private static Section section(String title, Map<String, Money> totals, String currency) {
        Money subtotal = Money.zero(currency);
        for (Money amount : totals.values()) {
            subtotal = subtotal.add(amount);
        }

        List<LineItem> items = new ArrayList<>(totals.size());
        for (Map.Entry<String, Money> e : totals.entrySet()) {
            items.add(new LineItem(e.getKey(), e.getValue(), percentage(e.getValue(), subtotal)));
        }
        items.sort(LINE_ITEM_ORDER);

        return new Section(title, items, subtotal);
    }

    private static BigDecimal percentage(Money amount, Money subtotal) {
        if (!subtotal.isPositive()) {
            return BigDecimal.ZERO.setScale(2);
        }
        return BigDecimal.valueOf(amount.amount())
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(subtotal.amount()), 2, RoundingMode.HALF_UP);
    }

    private static <T> List<T> orEmpty(List<T> rows) {
        return rows == null ? List.of() : rows;
    }
}
