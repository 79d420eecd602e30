package com.ledgerbook.finance.dto.reports;

import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncomeStatementResponseDTO {
    private String title;
    private LocalDate startDate;
    private LocalDate endDate;
    private StatementView statement;
}
