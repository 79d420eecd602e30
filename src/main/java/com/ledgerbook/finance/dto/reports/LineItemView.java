package com.ledgerbook.finance.dto.reports;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineItemView {
    private String category;
    private long amount;
    private String amountFormatted;
    private BigDecimal percentage;
    private String percentageFormatted;
}
