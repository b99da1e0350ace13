package com.autobot.api.health;

import com.autobot.engine.EngineRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Adds the running jobs to {@code /health}. Always UP: a job that failed to start is reported by its
 * absence, not as an outage.
 */
@Component("engines")
@RequiredArgsConstructor
public class EngineHealthIndicator implements HealthIndicator {

    private final EngineRegistry engineRegistry;

    @Override
    public Health health() {
        List<String> jobIds = engineRegistry.activeJobIds();
        return Health.up()
                .withDetail("activeCount", jobIds.size())
                .withDetail("jobIds", jobIds)
                .build();
    }
}
