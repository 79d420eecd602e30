package com.ledgerbook.finance.dto.accounts;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class MoneyAccountRequestDTO {

    @NotBlank(message = "name is required")
    @Size(max = 255, message = "name must be at most 255 characters")
    private String name;

    @Size(max = 255, message = "accountNumber must be at most 255 characters")
    private String accountNumber;

    @Size(max = 255, message = "description must be at most 255 characters")
    private String description;

    /** Minor units of {@link #currency}; may be negative for an overdrawn account. */
    @NotNull(message = "balance is required")
    private Long balance;

    @NotBlank(message = "currency is required")
    @Pattern(regexp = "[A-Za-z]{3}", message = "currency must be a three-letter ISO 4217 code")
    private String currency;
}
