package com.ledgerbook.finance.events;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import com.ledgerbook.finance.config.AsyncExecutorConfig;
import com.ledgerbook.finance.notifications.ExpenseStreamHub;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Pushes committed expense changes to stream subscribers, off the request thread.
 * A rolled back write produces no notification.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExpenseEventBroadcaster {

    private final ExpenseStreamHub expenseStreamHub;

    @Async(AsyncExecutorConfig.EXPENSE_BROADCAST_EXECUTOR)
    @TransactionalEventListener(fallbackExecution = true)
    public void onExpenseChanged(ExpenseChangedEvent event) {
        int delivered = expenseStreamHub.broadcast(event.eventName(), event);
        log.debug("[ExpenseEventBroadcaster] type={} expenseId={} delivered={}",
                event.type(), event.expense().getId(), delivered);
    }
}
