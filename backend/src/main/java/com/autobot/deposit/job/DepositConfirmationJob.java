package com.autobot.deposit.job;

import com.autobot.deposit.config.DepositProperties;
import com.autobot.engine.Frequency;
import com.autobot.engine.JobInitializationException;
import com.autobot.engine.JobSchedule;
import com.autobot.engine.JobTask;
import com.autobot.polling.PollSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Deposit confirmation job: one pass over all pending deposits per invocation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DepositConfirmationJob implements JobTask {

    public static final String JOB_ID = "deposit-confirmation";
    public static final JobSchedule DEFAULT_SCHEDULE = JobSchedule.every(Frequency.MINUTE);

    private final DepositConfirmationPoller poller;
    private final DepositProperties properties;

    @Override
    public void initialize() {
        if (!StringUtils.hasText(properties.getBridgeApiUrl()) || !StringUtils.hasText(properties.getSubmitUrl())) {
            throw new JobInitializationException("autobot.deposit.bridge-api-url and submit-url must be configured");
        }
        if (properties.getChains().isEmpty()) {
            log.warn("No chains configured under autobot.deposit.chains; every deposit will be left pending");
        }
    }

    @Override
    public void run() {
        PollSummary summary = poller.poll();
        log.info("Completed processing all deposits: {} processed, {} failed, {} chain(s) failed",
                summary.processedItems(), summary.failedItems(), summary.failedEntities());
    }
}
