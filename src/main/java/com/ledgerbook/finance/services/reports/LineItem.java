package com.ledgerbook.finance.services.reports;

import java.math.BigDecimal;

import com.ledgerbook.finance.money.Money;

/**
 * One category of a section. {@code percentage} is the share of the section
 * subtotal in the 0-100 range, scale 2.
 */
public record LineItem(String category, Money amount, BigDecimal percentage) {
}
