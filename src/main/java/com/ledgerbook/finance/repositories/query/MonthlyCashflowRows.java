package com.ledgerbook.finance.repositories.query;

import java.util.List;

import com.ledgerbook.finance.services.reports.MonthlyCategoryAmount;

public record MonthlyCashflowRows(List<MonthlyCategoryAmount> inflows, List<MonthlyCategoryAmount> outflows) {

    public MonthlyCashflowRows {
        inflows = List.copyOf(inflows);
        outflows = List.copyOf(outflows);
    }
}
