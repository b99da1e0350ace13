package com.autobot.mail.job;

import com.autobot.engine.Frequency;
import com.autobot.engine.JobSchedule;
import com.autobot.engine.JobTask;
import com.autobot.polling.PollSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Mail forwarder job: one forwarding pass over all active mailboxes per invocation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MailForwardJob implements JobTask {

    public static final String JOB_ID = "mail-forwarder";
    public static final JobSchedule DEFAULT_SCHEDULE = JobSchedule.every(Frequency.MINUTE);

    private final MailForwardPoller poller;

    @Override
    public void run() {
        PollSummary summary = poller.poll();
        log.info("Completed processing all mailboxes: {} message(s) processed, {} failed",
                summary.processedItems(), summary.failedItems());
    }
}
