package com.autobot.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Subject-substring to destination-address mapping. Embedded in {@link MailboxConfig}.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class ForwardRule {

    private String subjectSearch;
    private String destinationEmail;
}
