package com.ledgerbook.finance.dto.expenses;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ExpenseRequestDTO {

    @NotBlank(message = "accountId is required")
    private String accountId;

    @NotBlank(message = "categoryId is required")
    private String categoryId;

    /** Minor units of the account currency. */
    @NotNull(message = "amount is required")
    @Positive(message = "amount must be greater than zero")
    private Long amount;

    @Size(max = 255, message = "comment must be at most 255 characters")
    private String comment;

    @NotNull(message = "transactionDate is required")
    private LocalDate transactionDate;

    // defaults to transactionDate
    private LocalDate accountingPeriod;
}
