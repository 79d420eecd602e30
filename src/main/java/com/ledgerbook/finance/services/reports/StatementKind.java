package com.ledgerbook.finance.services.reports;

public enum StatementKind {

    INCOME_STATEMENT("Revenue", "Expenses"),
    CASHFLOW("Inflows", "Outflows");

    private final String inflowTitle;
    private final String outflowTitle;

    StatementKind(String inflowTitle, String outflowTitle) {
        this.inflowTitle = inflowTitle;
        this.outflowTitle = outflowTitle;
    }

    public String inflowTitle() {
        return inflowTitle;
    }

    public String outflowTitle() {
        return outflowTitle;
    }
}
