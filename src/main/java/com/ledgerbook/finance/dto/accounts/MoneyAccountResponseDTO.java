package com.ledgerbook.finance.dto.accounts;

import java.time.LocalDateTime;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MoneyAccountResponseDTO {
    private UUID id;
    private String name;
    private String accountNumber;
    private String description;
    private long balance;
    private String balanceFormatted;
    private String currency;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
