package com.ledgerbook.finance.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledgerbook.expenses")
public record ExpenseStreamProperties(
        Duration streamTimeout,
        int broadcastPoolSize,
        int broadcastQueueCapacity
) {
    public ExpenseStreamProperties {
        if (streamTimeout == null) {
            streamTimeout = Duration.ofMinutes(30);
        }
        if (broadcastPoolSize <= 0) {
            broadcastPoolSize = 2;
        }
        if (broadcastQueueCapacity <= 0) {
            broadcastQueueCapacity = 100;
        }
    }
}
