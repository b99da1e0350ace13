package com.autobot.config;

import com.autobot.deposit.job.DepositConfirmationJob;
import com.autobot.engine.EngineProperties;
import com.autobot.engine.EngineRegistry;
import com.autobot.engine.JobDefinition;
import com.autobot.mail.job.MailForwardJob;
import com.autobot.mirror.job.BranchMirrorJob;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.List;

/**
 * The job table: every job the process knows about, with its built-in schedule. Whether a job runs
 * and any schedule override come from {@code autobot.engine.jobs.<id>}.
 */
@Configuration
public class JobsConfig {

    @Bean
    public EngineRegistry engineRegistry(EngineProperties properties,
                                         MailForwardJob mailForwardJob,
                                         DepositConfirmationJob depositConfirmationJob,
                                         BranchMirrorJob branchMirrorJob,
                                         @Qualifier(SchedulerConfig.ENGINE_SCHEDULER) ThreadPoolTaskScheduler scheduler,
                                         @Qualifier(AsyncConfig.ENGINE_EXECUTOR) ThreadPoolTaskExecutor executor,
                                         Clock clock) {
        List<JobDefinition> jobs = List.of(
                new JobDefinition(MailForwardJob.JOB_ID, MailForwardJob.DEFAULT_SCHEDULE, mailForwardJob),
                new JobDefinition(DepositConfirmationJob.JOB_ID, DepositConfirmationJob.DEFAULT_SCHEDULE, depositConfirmationJob),
                new JobDefinition(BranchMirrorJob.JOB_ID, BranchMirrorJob.DEFAULT_SCHEDULE, branchMirrorJob));
        return new EngineRegistry(jobs, properties, scheduler, executor, clock);
    }
}
