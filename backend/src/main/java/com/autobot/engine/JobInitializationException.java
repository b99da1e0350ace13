package com.autobot.engine;

/**
 * Thrown when a job is missing configuration it needs to start. Caught per job by EngineRegistry.
 */
public class JobInitializationException extends RuntimeException {

    public JobInitializationException(String message) {
        super(message);
    }

    public JobInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
