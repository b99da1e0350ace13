package com.autobot.mail.adapter;

import java.util.Locale;

/**
 * IMAP transport security. IMPLICIT connects over TLS (imaps); PLAIN uses the imap protocol as is.
 */
public enum TlsMode {
    IMPLICIT,
    PLAIN;

    public static TlsMode parse(String value) {
        return value != null && "implicit".equals(value.trim().toLowerCase(Locale.ROOT)) ? IMPLICIT : PLAIN;
    }
}
