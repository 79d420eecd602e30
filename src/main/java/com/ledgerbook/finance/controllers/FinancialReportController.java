package com.ledgerbook.finance.controllers;

import java.time.LocalDate;

import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import com.ledgerbook.finance.dto.ApiResponse;
import com.ledgerbook.finance.dto.reports.IncomeStatementResponseDTO;
import com.ledgerbook.finance.dto.reports.StatementRequestDTO;
import com.ledgerbook.finance.services.FinancialReportService;
import com.ledgerbook.finance.services.reports.DateRange;
import com.ledgerbook.finance.validation.ReportRequestValidator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Income statement page, its HTMX fragment and the JSON variant.
 */
@Controller
@RequestMapping("/finance/reports/income-statement")
@RequiredArgsConstructor
@Slf4j
public class FinancialReportController {

    static final String VIEW = "reports/income-statement";
    static final String FRAGMENT = VIEW + " :: report";

    private final FinancialReportService financialReportService;
    private final ReportRequestValidator reportRequestValidator;

    @GetMapping
    public String page(
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            Model model
    ) {
        if (startDate != null || endDate != null) {
            DateRange range = reportRequestValidator.toDateRange(request(startDate, endDate));
            model.addAttribute("startDate", range.start());
            model.addAttribute("endDate", range.end());
            model.addAttribute("report", financialReportService.incomeStatementReport(range));
            return VIEW;
        }

        DateRange currentYear = DateRange.calendarYear(LocalDate.now().getYear());
        model.addAttribute("startDate", currentYear.start());
        model.addAttribute("endDate", currentYear.end());
        try {
            model.addAttribute("report", financialReportService.incomeStatementReport(currentYear));
        } catch (RuntimeException ex) {
            log.warn("[FinancialReportController] default income statement unavailable, showing form only: {}", ex.getMessage());
        }
        return VIEW;
    }

    @PostMapping("/generate")
    public String generate(
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            Model model
    ) {
        DateRange range = reportRequestValidator.toDateRange(request(startDate, endDate));
        log.info("[FinancialReportController] income statement start={} end={}", range.start(), range.end());
        model.addAttribute("report", financialReportService.incomeStatementReport(range));
        return FRAGMENT;
    }

    @GetMapping("/data")
    @ResponseBody
    public ResponseEntity<ApiResponse<IncomeStatementResponseDTO>> data(
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate
    ) {
        DateRange range = reportRequestValidator.toDateRange(request(startDate, endDate));
        IncomeStatementResponseDTO report = financialReportService.incomeStatementReport(range);
        return ResponseEntity.ok(ApiResponse.success(report, "Income statement generated successfully"));
    }

    private static StatementRequestDTO request(String startDate, String endDate) {
        return StatementRequestDTO.builder()
                .startDate(startDate)
                .endDate(endDate)
                .build();
    }
}
