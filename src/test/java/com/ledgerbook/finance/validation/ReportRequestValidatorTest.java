package com.ledgerbook.finance.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import com.ledgerbook.finance.dto.reports.StatementRequestDTO;
import com.ledgerbook.finance.exceptions.InvalidDateRangeException;
import com.ledgerbook.finance.services.reports.DateRange;

class ReportRequestValidatorTest {

    private final ReportRequestValidator validator = new ReportRequestValidator();

    private static StatementRequestDTO request(String start, String end, String account) {
        return StatementRequestDTO.builder().startDate(start).endDate(end).accountId(account).build();
    }

    @Test
    void validate_validRequest_noErrors() {
        Map<String, String> errors = validator.validate(request("2024-01-01", "2024-12-31", "all"), false);

        assertTrue(errors.isEmpty());
    }

    @Test
    void validate_missingAndMalformedDates_reportsEachField() {
        Map<String, String> errors = validator.validate(request(null, "2024-13-01", null), false);

        assertEquals(2, errors.size());
        assertEquals("Start date is required", errors.get(ReportRequestValidator.START_DATE));
        assertEquals("End date must use the yyyy-MM-dd format", errors.get(ReportRequestValidator.END_DATE));
    }

    @Test
    void validate_impossibleCalendarDate_isRejected() {
        Map<String, String> errors = validator.validate(request("2023-02-29", "2023-03-01", null), false);

        assertTrue(errors.containsKey(ReportRequestValidator.START_DATE));
    }

    @Test
    void validate_endBeforeStart_flagsEndDate() {
        Map<String, String> errors = validator.validate(request("2024-02-01", "2024-01-01", null), false);

        assertEquals(Map.of(ReportRequestValidator.END_DATE, "End date must not be before start date"), errors);
    }

    @Test
    void validate_accountRequired_rejectsAllAndBlank() {
        assertTrue(validator.validate(request("2024-01-01", "2024-01-31", "all"), true)
                .containsKey(ReportRequestValidator.ACCOUNT_ID));
        assertTrue(validator.validate(request("2024-01-01", "2024-01-31", " "), true)
                .containsKey(ReportRequestValidator.ACCOUNT_ID));
    }

    @Test
    void validate_malformedAccount_isRejected() {
        Map<String, String> errors = validator.validate(request("2024-01-01", "2024-01-31", "not-a-uuid"), false);

        assertEquals("Account id must be a valid UUID", errors.get(ReportRequestValidator.ACCOUNT_ID));
    }

    @Test
    void toDateRange_validRequest_buildsInclusiveRange() {
        DateRange range = validator.toDateRange(request("2024-01-01", "2024-03-31", "garbage"));

        assertEquals(LocalDate.of(2024, 1, 1), range.start());
        assertEquals(LocalDate.of(2024, 3, 31), range.end());
    }

    @Test
    void toDateRange_invalid_throwsWithAllErrors() {
        InvalidDateRangeException ex = assertThrows(InvalidDateRangeException.class,
                () -> validator.toDateRange(request("bad", "", null)));

        assertEquals(2, ex.getErrors().size());
    }

    @Test
    void toAccountId_allOrBlank_meansEveryAccount() {
        assertNull(validator.toAccountId("all", false));
        assertNull(validator.toAccountId("ALL", false));
        assertNull(validator.toAccountId(null, false));
    }

    @Test
    void toAccountId_uuid_isParsed() {
        UUID id = UUID.randomUUID();

        assertEquals(id, validator.toAccountId(id.toString(), true));
    }

    @Test
    void requireValid_collectsEveryField() {
        InvalidDateRangeException ex = assertThrows(InvalidDateRangeException.class,
                () -> validator.requireValid(request("2024-01-01", "bad", "nope"), true));

        assertTrue(ex.getErrors().containsKey(ReportRequestValidator.END_DATE));
        assertTrue(ex.getErrors().containsKey(ReportRequestValidator.ACCOUNT_ID));
    }
}
