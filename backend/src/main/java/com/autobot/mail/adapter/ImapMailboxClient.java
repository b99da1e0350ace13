package com.autobot.mail.adapter;

import jakarta.mail.Address;
import jakarta.mail.BodyPart;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.internet.InternetAddress;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Properties;

/**
 * IMAP inbox reader on Jakarta Mail. Opens INBOX read-only so reading never changes message flags.
 */
@Slf4j
public class ImapMailboxClient implements MailboxClient {

    private static final String INBOX = "INBOX";

    private final MailboxSettings settings;
    private final Properties sessionProperties;
    private final Clock clock;
    private Store store;
    private Folder inbox;

    public ImapMailboxClient(MailboxSettings settings, int connectTimeoutMs, int readTimeoutMs, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        String protocol = protocol();
        this.sessionProperties = new Properties();
        sessionProperties.put("mail.store.protocol", protocol);
        sessionProperties.put("mail." + protocol + ".connectiontimeout", String.valueOf(connectTimeoutMs));
        sessionProperties.put("mail." + protocol + ".timeout", String.valueOf(readTimeoutMs));
        if (settings.tls() == TlsMode.IMPLICIT) {
            sessionProperties.put("mail.imaps.ssl.checkserveridentity", "true");
        }
    }

    private String protocol() {
        return settings.tls() == TlsMode.IMPLICIT ? "imaps" : "imap";
    }

    @Override
    public void connect() {
        try {
            Session session = Session.getInstance(sessionProperties);
            store = session.getStore(protocol());
            store.connect(settings.host(), settings.port(), settings.email(), settings.password());
            inbox = store.getFolder(INBOX);
            inbox.open(Folder.READ_ONLY);
            log.info("IMAP connection ready for {}", settings.email());
        } catch (MessagingException e) {
            close();
            throw new MailboxException("IMAP connect failed for " + settings.email() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> listRecentMessageIds(int maxCount) {
        try {
            int total = openInbox().getMessageCount();
            List<String> ids = new ArrayList<>();
            if (total <= 0) {
                return ids;
            }
            int first = Math.max(1, total - maxCount + 1);
            for (int n = first; n <= total; n++) {
                ids.add(String.valueOf(n));
            }
            return ids;
        } catch (MessagingException e) {
            throw new MailboxException("Failed to list messages for " + settings.email(), e);
        }
    }

    @Override
    public MailMessage fetchMessage(String id) {
        try {
            Message message = openInbox().getMessage(Integer.parseInt(id));
            String subject = message.getSubject() != null ? message.getSubject() : "";
            String from = addresses(message.getFrom());
            Address[] recipients = message.getRecipients(Message.RecipientType.TO);
            String to = recipients != null && recipients.length > 0 ? recipients[0].toString() : "";
            Date sent = message.getSentDate() != null ? message.getSentDate() : message.getReceivedDate();
            return new MailMessage(
                    id,
                    subject,
                    from,
                    to,
                    extractText(message),
                    sent != null ? sent.toInstant() : clock.instant());
        } catch (MessagingException | IOException e) {
            throw new MailboxException("Failed to fetch message " + id + " for " + settings.email(), e);
        }
    }

    private Folder openInbox() {
        if (inbox == null || !inbox.isOpen()) {
            throw new MailboxException("Mailbox " + settings.email() + " is not connected");
        }
        return inbox;
    }

    private static String addresses(Address[] addresses) {
        if (addresses == null || addresses.length == 0) {
            return "";
        }
        return InternetAddress.toUnicodeString(addresses);
    }

    /**
     * First text/plain content found, depth first; empty if the message has none.
     */
    static String extractText(Part part) throws MessagingException, IOException {
        if (part.isMimeType("text/plain")) {
            Object content = part.getContent();
            return content != null ? content.toString() : "";
        }
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart bodyPart = multipart.getBodyPart(i);
                String text = extractText(bodyPart);
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return "";
    }

    @Override
    public void close() {
        try {
            if (inbox != null && inbox.isOpen()) {
                inbox.close(false);
            }
            if (store != null && store.isConnected()) {
                store.close();
            }
        } catch (MessagingException e) {
            log.warn("Failed to close IMAP connection for {}: {}", settings.email(), e.getMessage());
        } finally {
            inbox = null;
            store = null;
        }
    }
}
