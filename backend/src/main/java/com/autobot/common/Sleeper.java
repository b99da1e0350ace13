package com.autobot.common;

import java.time.Duration;

/**
 * Blocking pause, injectable so paced loops can be tested without real waits.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(Math.max(0L, duration.toMillis()));

    void sleep(Duration duration) throws InterruptedException;
}
