package com.ledgerbook.finance.notifications;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import com.ledgerbook.finance.config.ExpenseStreamProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Open server-sent event subscriptions to expense changes.
 * <p>
 * Delivery is best-effort: a subscriber whose send fails is logged and
 * dropped, and the remaining subscribers still receive the event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExpenseStreamHub {

    private final ExpenseStreamProperties properties;

    private final List<SseEmitter> subscribers = new CopyOnWriteArrayList<>();

    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(properties.streamTimeout().toMillis());
        register(emitter);
        log.info("[ExpenseStreamHub] subscriber added, active={}", subscribers.size());
        return emitter;
    }

    void register(SseEmitter emitter) {
        subscribers.add(emitter);
        emitter.onCompletion(() -> subscribers.remove(emitter));
        emitter.onTimeout(() -> subscribers.remove(emitter));
        emitter.onError(ex -> subscribers.remove(emitter));
    }

    /**
     * @return number of subscribers the event reached
     */
    public int broadcast(String eventName, Object payload) {
        int delivered = 0;
        for (SseEmitter emitter : subscribers) {
            try {
                emitter.send(SseEmitter.event().name(eventName).data(payload));
                delivered++;
            } catch (IOException | IllegalStateException ex) {
                log.warn("[ExpenseStreamHub] dropping subscriber after failed send of {}: {}", eventName, ex.getMessage());
                subscribers.remove(emitter);
            }
        }
        return delivered;
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
