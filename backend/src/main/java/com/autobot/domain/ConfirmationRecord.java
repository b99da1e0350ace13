package com.autobot.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Deposit awaiting confirmations. Created with confirmedHeight=0 on intake, updated once the block
 * height is known, deleted after a successful submit.
 */
@Document(collection = "deposit_confirmations")
@NoArgsConstructor
@Getter
@Setter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ConfirmationRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String chainId;
    private String txHash;
    private String txNonce;
    /** 0 while the transaction's block height is unknown. */
    private long confirmedHeight;
    private Instant createdAt;
    private Instant updatedAt;

    public static String idOf(String chainId, String txHash) {
        return chainId + "_" + txHash;
    }

    public boolean isHeightKnown() {
        return confirmedHeight > 0;
    }
}
