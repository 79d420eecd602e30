package com.ledgerbook.finance.dto.reports;

import java.util.List;

import com.ledgerbook.finance.services.reports.StatementKind;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatementView {
    private StatementKind kind;
    private String currency;

    private SectionView inflow;
    private SectionView outflow;

    private long netResult;
    private String netResultFormatted;
    private boolean profit;
    private boolean breakEven;

    private boolean monthlyBreakdown;
    private List<String> months;
    private List<MonthlyRowView> inflowMonths;
    private List<MonthlyRowView> outflowMonths;
}
