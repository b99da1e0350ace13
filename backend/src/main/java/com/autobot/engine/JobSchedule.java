package com.autobot.engine;

import org.springframework.scheduling.support.CronExpression;

/**
 * Cron expression or fixed frequency. When both are present the cron expression wins.
 * Five-field (minute-first) expressions are accepted and fire at second 0.
 */
public record JobSchedule(String cron, Frequency frequency) {

    public JobSchedule {
        if (cron != null && cron.isBlank()) {
            cron = null;
        }
        if (cron == null && frequency == null) {
            throw new IllegalArgumentException("Schedule requires a cron expression or a frequency");
        }
        if (cron != null && !CronExpression.isValidExpression(toSpringCron(cron))) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron);
        }
    }

    public static JobSchedule cron(String expression) {
        return new JobSchedule(expression, null);
    }

    public static JobSchedule every(Frequency frequency) {
        return new JobSchedule(null, frequency);
    }

    public boolean isCron() {
        return cron != null;
    }

    /** Six-field expression as understood by Spring's CronTrigger. */
    public String springCron() {
        return cron != null ? toSpringCron(cron) : null;
    }

    public String label() {
        return cron != null ? cron : frequency.label();
    }

    private static String toSpringCron(String expression) {
        String trimmed = expression.trim();
        return trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
    }
}
