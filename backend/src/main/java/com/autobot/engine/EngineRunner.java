package com.autobot.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one job on its schedule.
 * <ul>
 *   <li>Cron: each trigger dispatches one invocation to the executor. Invocations of the same job may
 *   overlap if one runs past the next trigger.</li>
 *   <li>Frequency: a single loop runs the job, then waits {@code period - elapsed} (never negative),
 *   so invocations never overlap.</li>
 * </ul>
 * A failed invocation is logged and never stops the runner. Stop requests do not interrupt a running
 * invocation; they cancel future triggers and wake a waiting frequency loop.
 */
@Slf4j
public class EngineRunner {

    private final JobDefinition job;
    private final TaskScheduler taskScheduler;
    private final Executor executor;
    private final Clock clock;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> cronFuture;

    public EngineRunner(JobDefinition job, TaskScheduler taskScheduler, Executor executor, Clock clock) {
        this.job = job;
        this.taskScheduler = taskScheduler;
        this.executor = executor;
        this.clock = clock;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Runner already started for job " + job.id());
        }
        JobSchedule schedule = job.schedule();
        if (schedule.isCron()) {
            cronFuture = taskScheduler.schedule(
                    () -> executor.execute(this::invokeOnce),
                    new CronTrigger(schedule.springCron()));
            log.info("[{}:{}] Cron engine scheduled", job.id(), schedule.label());
        } else {
            executor.execute(this::runFrequencyLoop);
            log.info("[{}:{}] Frequency engine started (period {})", job.id(), schedule.label(),
                    schedule.frequency().period());
        }
    }

    void runFrequencyLoop() {
        long periodMs = job.schedule().frequency().period().toMillis();
        while (!isStopRequested()) {
            Instant startedAt = clock.instant();
            invokeOnce();
            long elapsedMs = Duration.between(startedAt, clock.instant()).toMillis();
            long delayMs = delayUntilNextRun(periodMs, elapsedMs);
            if (!awaitNextRun(delayMs)) {
                break;
            }
        }
        log.info("[{}:{}] Frequency engine stopped", job.id(), job.schedule().label());
    }

    /**
     * Time to wait before the next frequency invocation: the remainder of the period, or zero when the
     * invocation took the whole period or longer.
     */
    public static long delayUntilNextRun(long periodMs, long elapsedMs) {
        return Math.max(0L, periodMs - elapsedMs);
    }

    /**
     * Runs the job once, logging instead of propagating any failure.
     *
     * @return true if the invocation completed without throwing
     */
    public boolean invokeOnce() {
        String label = job.schedule().label();
        try {
            job.task().run();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}:{}] Engine run interrupted", job.id(), label);
            return false;
        } catch (Throwable t) {
            log.error("[{}:{}] Engine failed to run: {}", job.id(), label, t.getMessage(), t);
            return false;
        }
    }

    /**
     * Waits before the next frequency invocation.
     *
     * @return false if a stop was requested (or the thread interrupted) while waiting
     */
    protected boolean awaitNextRun(long delayMs) {
        try {
            return !stopSignal.await(delayMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void requestStop() {
        if (stopSignal.getCount() == 0) {
            return;
        }
        stopSignal.countDown();
        ScheduledFuture<?> future = cronFuture;
        if (future != null) {
            future.cancel(false);
        }
        log.info("[{}:{}] Stop requested", job.id(), job.schedule().label());
    }

    public boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }
}
