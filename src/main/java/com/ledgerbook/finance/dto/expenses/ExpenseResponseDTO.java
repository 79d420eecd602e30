package com.ledgerbook.finance.dto.expenses;

import java.time.LocalDate;
import java.time.LocalDateTime;

import lombok.Data;

@Data
public class ExpenseResponseDTO {

    private String id;
    private String accountId;
    private String accountName;

    private String categoryId;
    private String categoryName;

    private long amount;
    private String amountFormatted;
    private String currency;
    private String comment;

    private LocalDate transactionDate;
    private LocalDate accountingPeriod;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
