package com.bank.dispute.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    // @Async signal delivery
    @Bean(name = "signalDeliveryExecutor")
    public Executor signalDeliveryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("SignalDelivery-");
        executor.initialize();
        return executor;
    }

    // @Async network submission and classification calls under the time limiter
    @Bean(name = "collaboratorExecutor")
    public Executor collaboratorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(10);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("Collaborator-");
        executor.initialize();
        return executor;
    }
}
