package com.alphacheck.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Worker pool the orchestrator fans checkers out to. */
@Configuration
public class AsyncConfig {

    @Value("${alphacheck.executor.core-pool-size:4}")
    private int corePoolSize;

    @Value("${alphacheck.executor.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${alphacheck.executor.queue-capacity:64}")
    private int queueCapacity;

    @Bean("checkerExecutor")
    public ThreadPoolTaskExecutor checkerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("checker-");
        // a full queue runs the checker on the calling thread instead of rejecting it
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
