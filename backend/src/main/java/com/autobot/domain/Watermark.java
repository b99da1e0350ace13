package com.autobot.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Per-entity polling cursor (e.g. last forwarded message date per mailbox). Never decreases.
 */
@Document(collection = "watermarks")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Watermark {

    @Id
    @EqualsAndHashCode.Include
    private String entityId;
    private Instant cursor;
    private Instant updatedAt;

    public Watermark(String entityId, Instant cursor, Instant updatedAt) {
        this.entityId = entityId;
        this.cursor = cursor;
        this.updatedAt = updatedAt;
    }
}
