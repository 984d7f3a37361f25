package com.ledgerlens.backend.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    /**
     * Runs chunk uploads. Pool size follows the configured upload concurrency so a window never queues.
     */
    @Bean(name = "importUploadTaskExecutor")
    public ThreadPoolTaskExecutor importUploadTaskExecutor(ImportProperties importProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(importProperties.concurrency());
        executor.setMaxPoolSize(importProperties.concurrency() * 2);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("import-upload-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "classificationFeedbackExecutor")
    public Executor classificationFeedbackExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("classify-feedback-");
        executor.initialize();
        return executor;
    }
}
