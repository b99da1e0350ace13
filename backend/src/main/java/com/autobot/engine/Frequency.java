package com.autobot.engine;

import java.time.Duration;
import java.util.Locale;

/**
 * Fixed-period schedule. The next invocation starts one period after the previous one started,
 * or immediately when the previous one overran.
 */
public enum Frequency {
    MINUTE(Duration.ofMinutes(1)),
    HOUR(Duration.ofHours(1)),
    DAY(Duration.ofDays(1)),
    WEEK(Duration.ofDays(7)),
    MONTH(Duration.ofDays(30));

    private final Duration period;

    Frequency(Duration period) {
        this.period = period;
    }

    public Duration period() {
        return period;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
