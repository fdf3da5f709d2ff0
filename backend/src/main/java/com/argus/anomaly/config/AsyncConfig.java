package com.argus.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    public static final String DETECTION_EXECUTOR = "detectionExecutor";

    @Bean(name = DETECTION_EXECUTOR)
    public ThreadPoolTaskExecutor detectionExecutor(DetectionProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, properties.getWorker().getThreads()));
        // Every job gets a thread as soon as it arrives; nothing waits in a queue
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("detection-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
