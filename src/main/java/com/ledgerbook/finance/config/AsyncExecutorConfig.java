package com.ledgerbook.finance.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    public static final String EXPENSE_BROADCAST_EXECUTOR = "expenseBroadcastTaskExecutor";

    @Bean(name = EXPENSE_BROADCAST_EXECUTOR)
    public Executor expenseBroadcastTaskExecutor(ExpenseStreamProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(properties.broadcastPoolSize());
        executor.setQueueCapacity(properties.broadcastQueueCapacity());
        executor.setThreadNamePrefix("expense-broadcast-");
        // full queue: drop the notification, never block the writer
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardPolicy());
        executor.initialize();
        return executor;
    }
}
