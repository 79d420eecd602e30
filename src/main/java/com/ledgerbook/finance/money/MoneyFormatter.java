package com.ledgerbook.finance.money;

public interface MoneyFormatter {

    String format(Money money);
}
