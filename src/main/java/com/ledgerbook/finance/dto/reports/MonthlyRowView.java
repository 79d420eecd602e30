package com.ledgerbook.finance.dto.reports;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One month of a section's breakdown table. {@code amounts} maps category
 * name to formatted amount; categories without activity that month are absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyRowView {
    private String month;
    private String label;
    private Map<String, String> amounts;
    private long total;
    private String totalFormatted;
}
