package com.ledgerbook.finance.events;

public enum ExpenseEventType {
    CREATED,
    UPDATED,
    DELETED
}
