package com.ledgerbook.finance.events;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Objects;

import com.ledgerbook.finance.dto.expenses.ExpenseResponseDTO;

/**
 * Published once per expense write. For {@link ExpenseEventType#DELETED}
 * the payload is the expense as it was before removal.
 */
public record ExpenseChangedEvent(ExpenseEventType type, ExpenseResponseDTO expense, LocalDateTime occurredAt) {

    public ExpenseChangedEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(expense, "expense");
        if (occurredAt == null) {
            occurredAt = LocalDateTime.now();
        }
    }

    public static ExpenseChangedEvent of(ExpenseEventType type, ExpenseResponseDTO expense) {
        return new ExpenseChangedEvent(type, expense, LocalDateTime.now());
    }

    /** SSE event name, e.g. {@code expense-created}. */
    public String eventName() {
        return "expense-" + type.name().toLowerCase(Locale.ROOT);
    }
}
