package com.autobot.config;

import com.autobot.engine.EngineProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Engine worker pool: hosts frequency loops (one long-lived thread per frequency job) and cron
 * invocations. Shutdown waits for in-flight invocations instead of interrupting them.
 */
@Configuration
public class AsyncConfig {

    public static final String ENGINE_EXECUTOR = "engine-executor";

    @Bean(name = ENGINE_EXECUTOR)
    public ThreadPoolTaskExecutor engineExecutor(EngineProperties properties) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(properties.getExecutorThreads());
        e.setMaxPoolSize(properties.getExecutorThreads());
        e.setQueueCapacity(100);
        e.setThreadNamePrefix("engine-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(60);
        e.initialize();
        return e;
    }
}
