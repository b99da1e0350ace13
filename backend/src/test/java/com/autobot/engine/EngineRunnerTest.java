package com.autobot.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class EngineRunnerTest {

    private static final Instant T0 = Instant.parse("2025-01-15T10:00:00Z");

    @Mock
    TaskScheduler taskScheduler;
    @Mock
    ScheduledFuture<Object> cronFuture;

    @Test
    @DisplayName("period 60s, run 15s -> wait 45s; run 70s -> wait 0")
    void delayUntilNextRun_remainderOfPeriodNeverNegative() {
        assertThat(EngineRunner.delayUntilNextRun(60_000, 15_000)).isEqualTo(45_000);
        assertThat(EngineRunner.delayUntilNextRun(60_000, 70_000)).isZero();
        assertThat(EngineRunner.delayUntilNextRun(60_000, 60_000)).isZero();
    }

    @Test
    @DisplayName("frequency loop waits period minus elapsed after each run")
    void frequencyLoop_pacesByElapsedTime() {
        MutableClock clock = new MutableClock(T0);
        List<Duration> runDurations = List.of(Duration.ofSeconds(15), Duration.ofSeconds(70), Duration.ofSeconds(1));
        AtomicInteger runs = new AtomicInteger();
        JobTask task = () -> clock.advance(runDurations.get(runs.getAndIncrement()));
        List<Long> waits = new ArrayList<>();
        EngineRunner runner = new EngineRunner(job(JobSchedule.every(Frequency.MINUTE), task), taskScheduler, Runnable::run, clock) {
            @Override
            protected boolean awaitNextRun(long delayMs) {
                waits.add(delayMs);
                return waits.size() < 3;
            }
        };

        runner.runFrequencyLoop();

        assertThat(runs.get()).isEqualTo(3);
        assertThat(waits).containsExactly(45_000L, 0L, 59_000L);
    }

    @Test
    @DisplayName("a failing invocation is logged and the loop keeps running")
    void frequencyLoop_failureDoesNotStopRunner() {
        AtomicInteger runs = new AtomicInteger();
        JobTask task = () -> {
            if (runs.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
        };
        EngineRunner runner = new EngineRunner(job(JobSchedule.every(Frequency.MINUTE), task), taskScheduler,
                Runnable::run, new MutableClock(T0)) {
            @Override
            protected boolean awaitNextRun(long delayMs) {
                return runs.get() < 3;
            }
        };

        runner.runFrequencyLoop();

        assertThat(runs.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("an Error thrown by the job does not end the frequency loop")
    void frequencyLoop_errorDoesNotStopRunner() {
        AtomicInteger runs = new AtomicInteger();
        JobTask task = () -> {
            if (runs.incrementAndGet() == 1) {
                throw new NoClassDefFoundError("com/example/Missing");
            }
        };
        EngineRunner runner = new EngineRunner(job(JobSchedule.every(Frequency.MINUTE), task), taskScheduler,
                Runnable::run, new MutableClock(T0)) {
            @Override
            protected boolean awaitNextRun(long delayMs) {
                return runs.get() < 2;
            }
        };

        runner.runFrequencyLoop();

        assertThat(runs.get()).isEqualTo(2);
    }

    @Test
    void frequencyLoop_stopRequestedBeforeStart_neverRuns() {
        AtomicInteger runs = new AtomicInteger();
        EngineRunner runner = new EngineRunner(job(JobSchedule.every(Frequency.MINUTE), runs::incrementAndGet),
                taskScheduler, Runnable::run, new MutableClock(T0));

        runner.requestStop();
        runner.runFrequencyLoop();

        assertThat(runs.get()).isZero();
        assertThat(runner.isStopRequested()).isTrue();
    }

    @Test
    @DisplayName("stop wakes a waiting frequency loop")
    void awaitNextRun_returnsFalseOnceStopped() {
        EngineRunner runner = new EngineRunner(job(JobSchedule.every(Frequency.DAY), () -> { }),
                taskScheduler, Runnable::run, new MutableClock(T0));

        assertThat(runner.awaitNextRun(1)).isTrue();
        runner.requestStop();
        assertThat(runner.awaitNextRun(60_000)).isFalse();
    }

    @Test
    void invokeOnce_reportsOutcome() {
        EngineRunner ok = new EngineRunner(job(JobSchedule.every(Frequency.MINUTE), () -> { }),
                taskScheduler, Runnable::run, new MutableClock(T0));
        EngineRunner failing = new EngineRunner(job(JobSchedule.every(Frequency.MINUTE), () -> {
            throw new Exception("down");
        }), taskScheduler, Runnable::run, new MutableClock(T0));

        assertThat(ok.invokeOnce()).isTrue();
        assertThat(failing.invokeOnce()).isFalse();
    }

    @Test
    @DisplayName("cron trigger dispatches each firing to the executor; firings may overlap")
    void cron_eachTriggerDispatchesInvocation() {
        doReturn(cronFuture).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        List<Runnable> dispatched = new ArrayList<>();
        AtomicInteger runs = new AtomicInteger();
        EngineRunner runner = new EngineRunner(job(JobSchedule.cron("5 0 * * *"), runs::incrementAndGet),
                taskScheduler, dispatched::add, new MutableClock(T0));

        runner.start();

        ArgumentCaptor<Runnable> fire = ArgumentCaptor.forClass(Runnable.class);
        ArgumentCaptor<Trigger> trigger = ArgumentCaptor.forClass(Trigger.class);
        verify(taskScheduler).schedule(fire.capture(), trigger.capture());
        assertThat(trigger.getValue()).isInstanceOf(CronTrigger.class);
        assertThat(((CronTrigger) trigger.getValue()).getExpression()).isEqualTo("0 5 0 * * *");

        fire.getValue().run();
        fire.getValue().run();
        assertThat(dispatched).hasSize(2);
        assertThat(runs.get()).isZero();

        dispatched.forEach(Runnable::run);
        assertThat(runs.get()).isEqualTo(2);
    }

    @Test
    void cron_requestStopCancelsFutureTriggers() {
        doReturn(cronFuture).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        EngineRunner runner = new EngineRunner(job(JobSchedule.cron("0 * * * *"), () -> { }),
                taskScheduler, Runnable::run, new MutableClock(T0));
        runner.start();

        runner.requestStop();
        runner.requestStop();

        verify(cronFuture).cancel(false);
    }

    @Test
    void frequency_startHandsLoopToExecutor() {
        List<Runnable> dispatched = new ArrayList<>();
        EngineRunner runner = new EngineRunner(job(JobSchedule.every(Frequency.HOUR), () -> { }),
                taskScheduler, dispatched::add, new MutableClock(T0));

        runner.start();

        assertThat(dispatched).hasSize(1);
        verifyNoInteractions(taskScheduler);
    }

    @Test
    void start_twice_throws() {
        EngineRunner runner = new EngineRunner(job(JobSchedule.every(Frequency.HOUR), () -> { }),
                taskScheduler, r -> { }, new MutableClock(T0));
        runner.start();

        assertThatThrownBy(runner::start).isInstanceOf(IllegalStateException.class);
    }

    private static JobDefinition job(JobSchedule schedule, JobTask task) {
        return new JobDefinition("test-job", schedule, task);
    }
}
