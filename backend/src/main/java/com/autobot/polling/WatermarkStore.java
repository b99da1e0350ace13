package com.autobot.polling;

import com.autobot.domain.Watermark;
import com.autobot.domain.WatermarkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Reads and advances per-entity cursors. Writes only move a cursor forward.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WatermarkStore {

    private final WatermarkRepository repository;
    private final Clock clock;

    public Optional<Instant> get(String entityId) {
        return repository.findById(entityId).map(Watermark::getCursor);
    }

    /**
     * Stores the cursor if it is strictly after the stored one (or none is stored).
     *
     * @return true if the cursor was written
     */
    public boolean advance(String entityId, Instant cursor) {
        Optional<Watermark> existing = repository.findById(entityId);
        if (existing.isPresent() && existing.get().getCursor() != null
                && !cursor.isAfter(existing.get().getCursor())) {
            log.debug("Watermark for {} not advanced: {} is not after {}", entityId, cursor, existing.get().getCursor());
            return false;
        }
        repository.save(new Watermark(entityId, cursor, clock.instant()));
        log.info("Watermark for {} advanced to {}", entityId, cursor);
        return true;
    }
}
