package com.ledgerbook.finance.services.reports;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Locale;

import org.junit.jupiter.api.Test;

import com.ledgerbook.finance.dto.reports.MonthlyRowView;
import com.ledgerbook.finance.dto.reports.StatementView;
import com.ledgerbook.finance.money.LocaleMoneyFormatter;

class StatementFormatterTest {

    private final StatementAggregator aggregator = new StatementAggregator("USD");
    private final StatementFormatter formatter = new StatementFormatter(new LocaleMoneyFormatter(Locale.US), Locale.US);

    @Test
    void format_flatStatement_formatsSectionsAndNet() {
        Statement statement = aggregator.build(
                StatementKind.INCOME_STATEMENT,
                List.of(CategoryAmount.of("Sales", 1000000, "USD"), CategoryAmount.of("Services", 500000, "USD")),
                List.of(CategoryAmount.of("Rent", 600000, "USD"))
        );

        StatementView view = formatter.format(statement);

        assertEquals(StatementKind.INCOME_STATEMENT, view.getKind());
        assertEquals("USD", view.getCurrency());
        assertEquals("Revenue", view.getInflow().getTitle());
        assertEquals("$15,000.00", view.getInflow().getSubtotalFormatted());
        assertEquals("$10,000.00", view.getInflow().getItems().get(0).getAmountFormatted());
        assertEquals("66.67", view.getInflow().getItems().get(0).getPercentageFormatted());
        assertEquals("$9,000.00", view.getNetResultFormatted());
        assertEquals(900000, view.getNetResult());
        assertTrue(view.isProfit());
        assertFalse(view.isMonthlyBreakdown());
        assertTrue(view.getMonths().isEmpty());
        assertTrue(view.getInflowMonths().isEmpty());
    }

    @Test
    void format_monthlyStatement_buildsOneRowPerMonth() {
        Statement statement = aggregator.build(
                StatementKind.CASHFLOW,
                List.of(CategoryAmount.of("Sales", 3000, "USD")),
                List.of(),
                List.of(
                        MonthlyCategoryAmount.of(YearMonth.of(2024, 1), "Sales", 1000, "USD"),
                        MonthlyCategoryAmount.of(YearMonth.of(2024, 3), "Sales", 2000, "USD")
                ),
                List.of()
        );

        StatementView view = formatter.format(statement);

        assertTrue(view.isMonthlyBreakdown());
        assertEquals(List.of("2024-01", "2024-03"), view.getMonths());
        assertEquals(2, view.getInflowMonths().size());
        assertTrue(view.getOutflowMonths().isEmpty());

        MonthlyRowView march = view.getInflowMonths().get(1);
        assertEquals("2024-03", march.getMonth());
        assertEquals("Mar 2024", march.getLabel());
        assertEquals("$20.00", march.getAmounts().get("Sales"));
        assertEquals(2000, march.getTotal());
        assertEquals("$20.00", march.getTotalFormatted());
    }

    @Test
    void formatPercentage_roundsToTwoDecimals() {
        assertEquals("0.00", StatementFormatter.formatPercentage(null));
        assertEquals("33.33", StatementFormatter.formatPercentage(new BigDecimal("33.333")));
        assertEquals("66.67", StatementFormatter.formatPercentage(new BigDecimal("66.665")));
        assertEquals("100.00", StatementFormatter.formatPercentage(new BigDecimal("100")));
    }
}
