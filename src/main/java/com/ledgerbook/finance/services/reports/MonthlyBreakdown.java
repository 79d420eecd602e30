package com.ledgerbook.finance.services.reports;

import java.time.YearMonth;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.TreeSet;

import com.ledgerbook.finance.money.Money;

/**
 * Month-by-month amounts per category for both sides of a statement.
 * Months iterate in chronological order; categories keep the order in which
 * they were first seen.
 */
public final class MonthlyBreakdown {

    private final NavigableMap<YearMonth, Map<String, Money>> inflows;
    private final NavigableMap<YearMonth, Map<String, Money>> outflows;

    public MonthlyBreakdown(Map<YearMonth, Map<String, Money>> inflows, Map<YearMonth, Map<String, Money>> outflows) {
        this.inflows = freeze(inflows);
        this.outflows = freeze(outflows);
    }

    public NavigableMap<YearMonth, Map<String, Money>> inflows() {
        return inflows;
    }

    public NavigableMap<YearMonth, Map<String, Money>> outflows() {
        return outflows;
    }

    /** Union of the months present on either side, oldest first. */
    public List<YearMonth> months() {
        TreeSet<YearMonth> all = new TreeSet<>(inflows.keySet());
        all.addAll(outflows.keySet());
        return List.copyOf(all);
    }

    public boolean isEmpty() {
        return inflows.isEmpty() && outflows.isEmpty();
    }

    private static NavigableMap<YearMonth, Map<String, Money>> freeze(Map<YearMonth, Map<String, Money>> source) {
        TreeMap<YearMonth, Map<String, Money>> copy = new TreeMap<>();
        if (source != null) {
            source.forEach((month, byCategory) ->
                    copy.put(month, Collections.unmodifiableMap(new LinkedHashMap<>(byCategory))));
        }
        return Collections.unmodifiableNavigableMap(copy);
    }
}
