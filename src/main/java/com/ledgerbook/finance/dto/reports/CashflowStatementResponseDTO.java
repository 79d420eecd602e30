package com.ledgerbook.finance.dto.reports;

import java.time.LocalDate;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CashflowStatementResponseDTO {
    private String title;
    private UUID accountId;
    private String accountName;
    private LocalDate startDate;
    private LocalDate endDate;

    private long startingBalance;
    private String startingBalanceFormatted;
    private long endingBalance;
    private String endingBalanceFormatted;

    private StatementView statement;
}
