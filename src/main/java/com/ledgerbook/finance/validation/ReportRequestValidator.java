package com.ledgerbook.finance.validation;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.ledgerbook.finance.dto.reports.StatementRequestDTO;
import com.ledgerbook.finance.exceptions.InvalidDateRangeException;
import com.ledgerbook.finance.services.reports.DateRange;

/**
 * Checks raw report parameters before any query runs.
 * <p>
 * Dates are {@code yyyy-MM-dd}. The account id is either a UUID or, where
 * allowed, {@code all}/blank for every account.
 */
@Component
public class ReportRequestValidator {

    public static final String START_DATE = "start_date";
    public static final String END_DATE = "end_date";
    public static final String ACCOUNT_ID = "account_id";
    public static final String ALL_ACCOUNTS = "all";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    /**
     * @param requireAccount when true the account id must be a UUID
     * @return field name to message, empty when the request is valid
     */
    public Map<String, String> validate(StatementRequestDTO request, boolean requireAccount) {
        Map<String, String> errors = new LinkedHashMap<>();

        LocalDate start = parseDate(request.getStartDate(), START_DATE, "Start date", errors);
        LocalDate end = parseDate(request.getEndDate(), END_DATE, "End date", errors);
        if (start != null && end != null && start.isAfter(end)) {
            errors.put(END_DATE, "End date must not be before start date");
        }

        String accountId = request.getAccountId();
        if (isAllAccounts(accountId)) {
            if (requireAccount) {
                errors.put(ACCOUNT_ID, "Account id is required");
            }
        } else if (!isUuid(accountId)) {
            errors.put(ACCOUNT_ID, "Account id must be a valid UUID");
        }

        return errors;
    }

    /** Throws {@link InvalidDateRangeException} listing every bad field. */
    public void requireValid(StatementRequestDTO request, boolean requireAccount) {
        Map<String, String> errors = validate(request, requireAccount);
        if (!errors.isEmpty()) {
            throw new InvalidDateRangeException(errors);
        }
    }

    /** Checks the two dates only; the account id is ignored. */
    public DateRange toDateRange(StatementRequestDTO request) {
        Map<String, String> errors = validate(request, false);
        errors.remove(ACCOUNT_ID);
        if (!errors.isEmpty()) {
            throw new InvalidDateRangeException(errors);
        }
        return DateRange.of(LocalDate.parse(request.getStartDate().trim(), DATE),
                LocalDate.parse(request.getEndDate().trim(), DATE));
    }

    /** {@code null} stands for all accounts. */
    public UUID toAccountId(String accountId, boolean requireAccount) {
        if (isAllAccounts(accountId)) {
            if (requireAccount) {
                throw new InvalidDateRangeException(ACCOUNT_ID, "Account id is required");
            }
            return null;
        }
        if (!isUuid(accountId)) {
            throw new InvalidDateRangeException(ACCOUNT_ID, "Account id must be a valid UUID");
        }
        return UUID.fromString(accountId.trim());
    }

    private static LocalDate parseDate(String raw, String field, String label, Map<String, String> errors) {
        if (raw == null || raw.isBlank()) {
            errors.put(field, label + " is required");
            return null;
        }
        try {
            return LocalDate.parse(raw.trim(), DATE);
        } catch (DateTimeParseException ex) {
            errors.put(field, label + " must use the yyyy-MM-dd format");
            return null;
        }
    }

    private static boolean isAllAccounts(String accountId) {
        return accountId == null || accountId.isBlank() || ALL_ACCOUNTS.equalsIgnoreCase(accountId.trim());
    }

    private static boolean isUuid(String value) {
        try {
            UUID.fromString(value.trim());
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }
}
