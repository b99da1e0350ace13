package com.autobot.engine;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Engine config: which jobs run and optional schedule overrides. Key = job id (e.g. mail-forwarder).
 */
@ConfigurationProperties(prefix = "autobot.engine")
@NoArgsConstructor
@Getter
@Setter
public class EngineProperties {

    private Map<String, JobEntry> jobs = new HashMap<>();

    /** Threads hosting frequency loops and cron invocations. */
    private int executorThreads = 8;

    /** Threads firing cron triggers. */
    private int schedulerThreads = 2;

    public void setJobs(Map<String, JobEntry> jobs) {
        this.jobs = jobs != null ? jobs : new HashMap<>();
    }

    public boolean isEnabled(String jobId) {
        JobEntry entry = jobs.get(jobId);
        return entry != null && entry.isEnabled();
    }

    /**
     * Schedule for a job: the configured cron/frequency when set, otherwise the job's built-in schedule.
     */
    public JobSchedule scheduleFor(String jobId, JobSchedule builtIn) {
        JobEntry entry = jobs.get(jobId);
        if (entry == null || (isBlank(entry.getCron()) && entry.getFrequency() == null)) {
            return builtIn;
        }
        return new JobSchedule(entry.getCron(), entry.getFrequency());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class JobEntry {

        /** Jobs are off unless explicitly enabled. */
        private boolean enabled;
        private String cron;
        private Frequency frequency;
    }
}
