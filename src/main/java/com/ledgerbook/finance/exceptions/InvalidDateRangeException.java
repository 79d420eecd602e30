package com.ledgerbook.finance.exceptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rejected report request: malformed dates or an end date before the start date.
 * Carries one message per offending request field.
 */
public class InvalidDateRangeException extends RuntimeException {

    private final Map<String, String> errors;

    public InvalidDateRangeException(Map<String, String> errors) {
        super(errors == null || errors.isEmpty() ? "Invalid date range" : errors.values().iterator().next());
        this.errors = errors == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public InvalidDateRangeException(String field, String message) {
        this(Map.of(field, message));
    }

    public Map<String, String> getErrors() {
        return errors;
    }
}
