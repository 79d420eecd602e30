package com.ledgerbook.finance.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.ledgerbook.finance.dto.expenses.ExpenseResponseDTO;
import com.ledgerbook.finance.notifications.ExpenseStreamHub;

@ExtendWith(MockitoExtension.class)
class ExpenseEventBroadcasterTest {

    @Mock
    private ExpenseStreamHub expenseStreamHub;

    @InjectMocks
    private ExpenseEventBroadcaster broadcaster;

    @Test
    void onExpenseChanged_forwardsToHubUnderEventName() {
        ExpenseResponseDTO expense = new ExpenseResponseDTO();
        expense.setId("e-1");
        ExpenseChangedEvent event = ExpenseChangedEvent.of(ExpenseEventType.UPDATED, expense);
        when(expenseStreamHub.broadcast("expense-updated", event)).thenReturn(3);

        broadcaster.onExpenseChanged(event);

        verify(expenseStreamHub).broadcast("expense-updated", event);
    }

    @Test
    void eventName_isLowerCaseType() {
        ExpenseChangedEvent event = ExpenseChangedEvent.of(ExpenseEventType.DELETED, new ExpenseResponseDTO());

        assertEquals("expense-deleted", event.eventName());
    }
}
