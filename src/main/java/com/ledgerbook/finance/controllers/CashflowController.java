package com.ledgerbook.finance.controllers;

import java.time.LocalDate;
import java.util.UUID;

import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import com.ledgerbook.finance.dto.ApiResponse;
import com.ledgerbook.finance.dto.reports.CashflowStatementResponseDTO;
import com.ledgerbook.finance.dto.reports.StatementRequestDTO;
import com.ledgerbook.finance.services.FinancialReportService;
import com.ledgerbook.finance.services.MoneyAccountService;
import com.ledgerbook.finance.services.reports.DateRange;
import com.ledgerbook.finance.validation.ReportRequestValidator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Cashflow statement for one money account, or for all of them when the
 * account id is {@code all} or blank. The JSON variant needs an explicit account.
 */
@Controller
@RequestMapping("/finance/reports/cashflow")
@RequiredArgsConstructor
@Slf4j
public class CashflowController {

    static final String VIEW = "reports/cashflow";
    static final String FRAGMENT = VIEW + " :: report";

    private final FinancialReportService financialReportService;
    private final MoneyAccountService moneyAccountService;
    private final ReportRequestValidator reportRequestValidator;

    @GetMapping
    public String page(
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(name = "account_id", required = false) String accountId,
            Model model
    ) {
        model.addAttribute("accounts", moneyAccountService.findAll());
        model.addAttribute("accountId", accountId == null || accountId.isBlank() ? ReportRequestValidator.ALL_ACCOUNTS : accountId);

        if (startDate != null || endDate != null) {
            StatementRequestDTO request = request(startDate, endDate, accountId);
            reportRequestValidator.requireValid(request, false);
            DateRange range = reportRequestValidator.toDateRange(request);
            UUID account = reportRequestValidator.toAccountId(accountId, false);
            model.addAttribute("startDate", range.start());
            model.addAttribute("endDate", range.end());
            model.addAttribute("report", financialReportService.cashflowStatementReport(account, range));
            return VIEW;
        }

        DateRange currentYear = DateRange.calendarYear(LocalDate.now().getYear());
        model.addAttribute("startDate", currentYear.start());
        model.addAttribute("endDate", currentYear.end());
        try {
            UUID account = reportRequestValidator.toAccountId(accountId, false);
            model.addAttribute("report", financialReportService.cashflowStatementReport(account, currentYear));
        } catch (RuntimeException ex) {
            log.warn("[CashflowController] default cashflow unavailable, showing form only: {}", ex.getMessage());
        }
        return VIEW;
    }

    @PostMapping("/generate")
    public String generate(
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(name = "account_id", required = false) String accountId,
            Model model
    ) {
        StatementRequestDTO request = request(startDate, endDate, accountId);
        reportRequestValidator.requireValid(request, false);
        DateRange range = reportRequestValidator.toDateRange(request);
        UUID account = reportRequestValidator.toAccountId(accountId, false);
        log.info("[CashflowController] cashflow accountId={} start={} end={}",
                account == null ? ReportRequestValidator.ALL_ACCOUNTS : account, range.start(), range.end());
        model.addAttribute("report", financialReportService.cashflowStatementReport(account, range));
        return FRAGMENT;
    }

    @GetMapping("/data")
    @ResponseBody
    public ResponseEntity<ApiResponse<CashflowStatementResponseDTO>> data(
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(name = "account_id", required = false) String accountId
    ) {
        StatementRequestDTO request = request(startDate, endDate, accountId);
        reportRequestValidator.requireValid(request, true);
        DateRange range = reportRequestValidator.toDateRange(request);
        UUID account = reportRequestValidator.toAccountId(accountId, true);
        CashflowStatementResponseDTO report = financialReportService.cashflowStatementReport(account, range);
        return ResponseEntity.ok(ApiResponse.success(report, "Cashflow statement generated successfully"));
    }

    private static StatementRequestDTO request(String startDate, String endDate, String accountId) {
        return StatementRequestDTO.builder()
                .startDate(startDate)
                .endDate(endDate)
                .accountId(accountId)
                .build();
    }
}
