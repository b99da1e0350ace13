package com.autobot.config;

import com.autobot.engine.EngineRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the engines once the application is ready and requests stop when the context closes.
 * In-flight invocations are left to finish; the executor waits for them on shutdown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EngineLifecycle {

    private final EngineRegistry engineRegistry;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        engineRegistry.startAll();
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        log.info("Shutting down engines");
        engineRegistry.stopAll();
    }
}
