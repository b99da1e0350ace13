package com.autobot.config;

import com.autobot.engine.EngineProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Trigger pool for cron-mode jobs. Triggers only hand work to the engine executor, so two threads
 * are plenty.
 */
@Configuration
public class SchedulerConfig {

    public static final String ENGINE_SCHEDULER = "engine-scheduler";

    @Bean(name = ENGINE_SCHEDULER)
    public ThreadPoolTaskScheduler engineScheduler(EngineProperties properties) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(properties.getSchedulerThreads());
        s.setThreadNamePrefix("engine-trigger-");
        s.initialize();
        return s;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
