package com.ledgerbook.finance.repositories.query;

import java.util.List;

import com.ledgerbook.finance.services.reports.CategoryAmount;

public record CashflowRows(List<CategoryAmount> inflows, List<CategoryAmount> outflows) {

    public CashflowRows {
        inflows = List.copyOf(inflows);
        outflows = List.copyOf(outflows);
    }
}
