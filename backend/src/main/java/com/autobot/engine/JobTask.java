package com.autobot.engine;

/**
 * Body of a scheduled job. One call to {@link #run()} is one invocation.
 */
public interface JobTask {

    /**
     * Checks the job's required configuration before its first run.
     *
     * @throws JobInitializationException if the job cannot run at all
     */
    default void initialize() {
    }

    void run() throws Exception;
}
