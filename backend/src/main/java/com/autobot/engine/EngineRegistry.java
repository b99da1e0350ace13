package com.autobot.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Owns the registered jobs and one {@link EngineRunner} per enabled job. Started once at application
 * ready and stopped on shutdown; a job that fails to start is logged and does not affect the others.
 * Jobs are registered with their built-in schedule; configured overrides are applied at start.
 */
@Slf4j
public class EngineRegistry {

    private final List<JobDefinition> jobs;
    private final EngineProperties properties;
    private final TaskScheduler taskScheduler;
    private final Executor executor;
    private final Clock clock;
    private final Map<String, EngineRunner> runners = Collections.synchronizedMap(new LinkedHashMap<>());

    public EngineRegistry(List<JobDefinition> jobs, EngineProperties properties,
                          TaskScheduler taskScheduler, Executor executor, Clock clock) {
        this.jobs = List.copyOf(jobs);
        this.properties = properties;
        this.taskScheduler = taskScheduler;
        this.executor = executor;
        this.clock = clock;
    }

    public void startAll() {
        for (JobDefinition job : jobs) {
            if (!properties.isEnabled(job.id())) {
                log.info("{}: job disabled, not scheduling", job.id());
                continue;
            }
            if (runners.containsKey(job.id())) {
                log.warn("{}: job already running, ignoring duplicate start", job.id());
                continue;
            }
            try {
                JobDefinition effective = new JobDefinition(
                        job.id(), properties.scheduleFor(job.id(), job.schedule()), job.task());
                job.task().initialize();
                EngineRunner runner = createRunner(effective);
                runner.start();
                runners.put(job.id(), runner);
            } catch (Exception e) {
                log.error("{}: engine failed to initialize schedule: {}", job.id(), e.getMessage(), e);
            }
        }
        log.info("Engines started: {} of {} registered job(s)", runners.size(), jobs.size());
    }

    protected EngineRunner createRunner(JobDefinition job) {
        return new EngineRunner(job, taskScheduler, executor, clock);
    }

    public void stopAll() {
        List<EngineRunner> snapshot;
        synchronized (runners) {
            snapshot = new ArrayList<>(runners.values());
            runners.clear();
        }
        for (EngineRunner runner : snapshot) {
            runner.requestStop();
        }
        log.info("Stop requested on {} engine(s)", snapshot.size());
    }

    public List<String> activeJobIds() {
        synchronized (runners) {
            return List.copyOf(runners.keySet());
        }
    }

    public int activeCount() {
        return runners.size();
    }
}
