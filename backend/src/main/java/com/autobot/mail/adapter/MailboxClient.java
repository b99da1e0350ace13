package com.autobot.mail.adapter;

import java.util.List;

/**
 * Read side of a mailbox. One instance per mailbox per pass; {@link #connect()} before use.
 */
public interface MailboxClient extends AutoCloseable {

    /**
     * Blocks until the mailbox is open.
     *
     * @throws MailboxException if the connection or login fails (connect timeout applies)
     */
    void connect();

    /** Ids of the {@code maxCount} most recent inbox messages, oldest first. */
    List<String> listRecentMessageIds(int maxCount);

    MailMessage fetchMessage(String id);

    @Override
    void close();
}
