package com.ledgerbook.finance.dto.reports;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw report parameters as submitted ({@code start_date}, {@code end_date},
 * {@code account_id}); checked by {@code ReportRequestValidator}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatementRequestDTO {
    private String startDate;
    private String endDate;
    private String accountId;
}
