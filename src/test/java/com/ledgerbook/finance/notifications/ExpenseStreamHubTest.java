package com.ledgerbook.finance.notifications;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import com.ledgerbook.finance.config.ExpenseStreamProperties;

class ExpenseStreamHubTest {

    private ExpenseStreamHub hub;

    @BeforeEach
    void setUp() {
        hub = new ExpenseStreamHub(new ExpenseStreamProperties(Duration.ofMinutes(1), 2, 10));
    }

    @Test
    void subscribe_registersEmitter() {
        SseEmitter emitter = hub.subscribe();

        assertEquals(Long.valueOf(60_000), emitter.getTimeout());
        assertEquals(1, hub.subscriberCount());
    }

    @Test
    void broadcast_reachesEverySubscriber() throws IOException {
        SseEmitter first = mock(SseEmitter.class);
        SseEmitter second = mock(SseEmitter.class);
        hub.register(first);
        hub.register(second);

        int delivered = hub.broadcast("expense-created", "payload");

        assertEquals(2, delivered);
        verify(first).send(any(SseEmitter.SseEventBuilder.class));
        verify(second).send(any(SseEmitter.SseEventBuilder.class));
    }

    @Test
    void broadcast_failedSend_dropsSubscriberAndContinues() throws IOException {
        SseEmitter broken = mock(SseEmitter.class);
        SseEmitter healthy = mock(SseEmitter.class);
        doThrow(new IOException("client gone")).when(broken).send(any(SseEmitter.SseEventBuilder.class));
        hub.register(broken);
        hub.register(healthy);

        int delivered = hub.broadcast("expense-deleted", "payload");

        assertEquals(1, delivered);
        assertEquals(1, hub.subscriberCount());
        verify(healthy).send(any(SseEmitter.SseEventBuilder.class));

        hub.broadcast("expense-deleted", "again");
        verify(broken, times(1)).send(any(SseEmitter.SseEventBuilder.class));
    }

    @Test
    void broadcast_completedEmitter_isDropped() throws IOException {
        SseEmitter completed = mock(SseEmitter.class);
        doThrow(new IllegalStateException("already completed")).when(completed).send(any(SseEmitter.SseEventBuilder.class));
        hub.register(completed);

        assertEquals(0, hub.broadcast("expense-updated", "payload"));
        assertEquals(0, hub.subscriberCount());
    }

    @Test
    void broadcast_noSubscribers_deliversNothing() {
        assertEquals(0, hub.broadcast("expense-created", "payload"));
    }
}
