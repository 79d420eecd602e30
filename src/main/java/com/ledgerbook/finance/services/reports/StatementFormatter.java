package com.ledgerbook.finance.services.reports;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;

import com.ledgerbook.finance.dto.reports.LineItemView;
import com.ledgerbook.finance.dto.reports.MonthlyRowView;
import com.ledgerbook.finance.dto.reports.SectionView;
import com.ledgerbook.finance.dto.reports.StatementView;
import com.ledgerbook.finance.money.Money;
import com.ledgerbook.finance.money.MoneyFormatter;

/**
 * Maps a {@link Statement} to its display form: formatted amounts, two-decimal
 * percentages and, when present, one table row per month and section.
 */
public class StatementFormatter {

    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM");

    private final MoneyFormatter moneyFormatter;
    private final DateTimeFormatter monthLabel;

    public StatementFormatter(MoneyFormatter moneyFormatter, Locale locale) {
        this.moneyFormatter = Objects.requireNonNull(moneyFormatter, "moneyFormatter");
        this.monthLabel = DateTimeFormatter.ofPattern("MMM yyyy", Objects.requireNonNull(locale, "locale"));
    }

    public StatementView format(Statement statement) {
        StatementView.StatementViewBuilder view = StatementView.builder()
                .kind(statement.kind())
                .currency(statement.currency())
                .inflow(section(statement.inflow()))
                .outflow(section(statement.outflow()))
                .netResult(statement.netResult().amount())
                .netResultFormatted(moneyFormatter.format(statement.netResult()))
                .profit(statement.isProfit())
                .breakEven(statement.isBreakEven())
                .monthlyBreakdown(statement.hasMonthlyBreakdown());

        MonthlyBreakdown monthly = statement.monthly();
        if (monthly == null) {
            return view.months(List.of())
                    .inflowMonths(List.of())
                    .outflowMonths(List.of())
                    .build();
        }

        List<String> months = monthly.months().stream().map(MONTH_KEY::format).toList();
        return view.months(months)
                .inflowMonths(rows(monthly.inflows(), statement.currency()))
                .outflowMonths(rows(monthly.outflows(), statement.currency()))
                .build();
    }

    public String formatMoney(Money money) {
        return moneyFormatter.format(money);
    }

    public static String formatPercentage(BigDecimal percentage) {
        if (percentage == null) return "0.00";
        return percentage.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private SectionView section(Section section) {
        List<LineItemView> items = new ArrayList<>(section.items().size());
        for (LineItem item : section.items()) {
            items.add(LineItemView.builder()
                    .category(item.category())
                    .amount(item.amount().amount())
                    .amountFormatted(moneyFormatter.format(item.amount()))
                    .percentage(item.percentage())
                    .percentageFormatted(formatPercentage(item.percentage()))
                    .build());
        }

        return SectionView.builder()
                .title(section.title())
                .items(items)
                .subtotal(section.subtotal().amount())
                .subtotalFormatted(moneyFormatter.format(section.subtotal()))
                .build();
    }

    private List<MonthlyRowView> rows(NavigableMap<YearMonth, Map<String, Money>> grid, String currency) {
        List<MonthlyRowView> rows = new ArrayList<>(grid.size());
        for (Map.Entry<YearMonth, Map<String, Money>> month : grid.entrySet()) {
            Map<String, String> amounts = new LinkedHashMap<>();
            Money total = Money.zero(currency);
            for (Map.Entry<String, Money> e : month.getValue().entrySet()) {
                amounts.put(e.getKey(), moneyFormatter.format(e.getValue()));
                total = total.add(e.getValue());
            }
            rows.add(MonthlyRowView.builder()
                    .month(MONTH_KEY.format(month.getKey()))
                    .label(monthLabel.format(month.getKey()))
                    .amounts(amounts)
                    .total(total.amount())
                    .totalFormatted(moneyFormatter.format(total))
                    .build());
        }
        return rows;
    }
}
