package com.ledgerbook.finance.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;

import com.ledgerbook.finance.config.ReportsProperties;
import com.ledgerbook.finance.dto.reports.CashflowStatementResponseDTO;
import com.ledgerbook.finance.dto.reports.IncomeStatementResponseDTO;
import com.ledgerbook.finance.entities.MoneyAccount;
import com.ledgerbook.finance.entities.Payment;
import com.ledgerbook.finance.entities.PaymentCategory;
import com.ledgerbook.finance.repositories.MoneyAccountRepository;
import com.ledgerbook.finance.repositories.PaymentCategoryRepository;
import com.ledgerbook.finance.repositories.PaymentRepository;
import com.ledgerbook.finance.repositories.query.JpaFinancialReportsQueryRepository;
import com.ledgerbook.finance.repositories.query.MonthlyCashflowRows;
import com.ledgerbook.finance.services.reports.DateRange;
import com.ledgerbook.finance.services.reports.MonthlyCategoryAmount;

import jakarta.persistence.EntityManager;

/**
 * Runs the monthly fallback against a real transaction manager, with a
 * monthly query that fails inside the database.
 */
@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:ledgerbook_fallback;DB_CLOSE_DELAY=-1;MODE=PostgreSQL"
})
@Import(FinancialReportServiceFallbackTest.BrokenMonthlyQueries.class)
class FinancialReportServiceFallbackTest {

    private static final DateRange YEAR_2024 = DateRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31));

    @TestConfiguration
    static class BrokenMonthlyQueries {

        @Bean
        @Primary
        JpaFinancialReportsQueryRepository brokenMonthlyQueryRepository(
                EntityManager entityManager,
                ReportsProperties reportsProperties
        ) {
            return new MissingTableQueryRepository(entityManager, reportsProperties);
        }
    }

    static class MissingTableQueryRepository extends JpaFinancialReportsQueryRepository {

        private final EntityManager entityManager;

        MissingTableQueryRepository(EntityManager entityManager, ReportsProperties reportsProperties) {
            super(entityManager, reportsProperties);
            this.entityManager = entityManager;
        }

        @Override
        public List<MonthlyCategoryAmount> getMonthlyIncomeByCategory(DateRange range) {
            entityManager.createNativeQuery("select * from missing_report_table").getResultList();
            return List.of();
        }

        @Override
        public MonthlyCashflowRows getMonthlyCashflowByCategory(DateRange range, UUID accountId) {
            entityManager.createNativeQuery("select * from missing_report_table").getResultList();
            return new MonthlyCashflowRows(List.of(), List.of());
        }
    }

    @Autowired
    private FinancialReportService service;

    @Autowired
    private MoneyAccountRepository moneyAccountRepository;

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private PaymentCategoryRepository paymentCategoryRepository;

    private MoneyAccount checking;

    @BeforeEach
    void setUp() {
        checking = moneyAccountRepository.save(
                MoneyAccount.builder().name("Checking").balance(100000).currency("USD").build());
        PaymentCategory sales = paymentCategoryRepository.save(PaymentCategory.builder().name("Sales").build());

        paymentRepository.save(Payment.builder()
                .account(checking)
                .category(sales)
                .amount(10000)
                .transactionDate(LocalDate.of(2024, 3, 15))
                .accountingPeriod(LocalDate.of(2024, 3, 15))
                .build());
    }

    @AfterEach
    void tearDown() {
        paymentRepository.deleteAll();
        paymentCategoryRepository.deleteAll();
        moneyAccountRepository.deleteAll();
    }

    @Test
    @DisplayName("income statement falls back to the flat view when the monthly query fails in the database")
    void incomeStatementReport_monthlyQueryFailureReturnsFlatView() {
        IncomeStatementResponseDTO report = service.incomeStatementReport(YEAR_2024);

        assertFalse(report.getStatement().isMonthlyBreakdown());
        assertTrue(report.getStatement().getMonths().isEmpty());
        assertEquals(10000, report.getStatement().getInflow().getSubtotal());
        assertEquals("Sales", report.getStatement().getInflow().getItems().get(0).getCategory());
        assertEquals(10000, report.getStatement().getNetResult());
    }

    @Test
    @DisplayName("cashflow falls back to the flat view when the monthly query fails in the database")
    void cashflowStatementReport_monthlyQueryFailureReturnsFlatView() {
        CashflowStatementResponseDTO report = service.cashflowStatementReport(checking.getId(), YEAR_2024);

        assertFalse(report.getStatement().isMonthlyBreakdown());
        assertEquals(10000, report.getStatement().getInflow().getSubtotal());
        assertEquals(100000, report.getEndingBalance());
        assertEquals(90000, report.getStartingBalance());
    }
}
