package com.pinclick.copilot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TaskExecutorConfig {

    @Value("${copilot.external.pool-size:16}")
    private int poolSize;

    @Bean("externalCallExecutor")
    public AsyncTaskExecutor externalCallExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(2, poolSize / 2));
        executor.setMaxPoolSize(Math.max(2, poolSize));
        // rejects with TaskRejectedException once full
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("ExternalCall-");
        executor.initialize();
        return executor;
    }
}
