package com.ledgerbook.finance.dto.reports;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SectionView {
    private String title;
    private List<LineItemView> items;
    private long subtotal;
    private String subtotalFormatted;
}
