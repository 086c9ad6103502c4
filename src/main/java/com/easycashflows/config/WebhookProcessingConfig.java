package com.easycashflows.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
public class WebhookProcessingConfig {

    @Bean(name = "webhookProcessingExecutor")
    public Executor webhookProcessingExecutor(WebhookProperties properties) {
        int threads = properties.processingThreads() == null ? 4 : Math.max(1, properties.processingThreads());
        int queueCapacity = properties.processingQueueCapacity() == null ? 500 : properties.processingQueueCapacity();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Math.max(50, queueCapacity));
        executor.setThreadNamePrefix("webhook-in-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "webhookDispatchExecutor")
    public Executor webhookDispatchExecutor(WebhookProperties properties) {
        int threads = properties.dispatchThreads() == null ? 8 : Math.max(1, properties.dispatchThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("webhook-out-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock webhookClock(WebhookProperties properties) {
        return Clock.system(properties.resolveZone());
    }
}
