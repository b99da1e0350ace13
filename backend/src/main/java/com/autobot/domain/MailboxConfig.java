package com.autobot.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored mailbox configuration, keyed by email address. Optional fields (host, port, tls, active)
 * may be null here; defaults are applied when the config is turned into runtime settings.
 */
@Document(collection = "mailbox_configs")
@NoArgsConstructor
@Getter
@Setter
public class MailboxConfig {

    @Id
    private String email;
    private String password;
    @Indexed
    private Boolean active;
    private String host;
    private Integer port;
    /** "implicit" for IMAPS on connect; anything else connects in plain mode. */
    private String tls;
    private List<ForwardRule> forwardRules = new ArrayList<>();
    private Instant updatedAt;

    public void setForwardRules(List<ForwardRule> forwardRules) {
        this.forwardRules = forwardRules != null ? forwardRules : new ArrayList<>();
    }
}
