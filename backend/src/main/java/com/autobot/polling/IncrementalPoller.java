package com.autobot.polling;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Fetch-since-cursor / act / advance-cursor pass over a set of entities.
 * <p>
 * For each entity: open a {@link ProgressTracker} (reads the cursor), fetch candidates, process each
 * accepted candidate in source order, then commit the tracker. A failure opening the tracker or
 * fetching candidates skips that entity; a failure processing an item skips that item. Nothing is
 * retried within a pass; the next scheduled pass is the retry.
 *
 * @param <E> polled entity (mailbox, chain batch)
 * @param <I> candidate item (message, pending deposit)
 */
@Slf4j
public abstract class IncrementalPoller<E, I> {

    /** Name used in log lines. */
    protected abstract String name();

    /** Active entities; a failure here fails the whole pass. */
    protected abstract List<E> listEntities();

    protected abstract String entityId(E entity);

    protected abstract ProgressTracker<I> openTracker(E entity);

    /** Candidates for the entity, in the order the source presents them. */
    protected abstract List<I> fetchCandidates(E entity) throws Exception;

    protected abstract String itemId(I item);

    /** Domain action for one item. Throwing marks the item failed. */
    protected abstract void process(E entity, I item) throws Exception;

    public PollSummary poll() {
        List<E> entities = listEntities();
        log.info("{}: polling {} entit(ies)", name(), entities.size());
        int failedEntities = 0;
        int processed = 0;
        int skipped = 0;
        int failed = 0;
        for (E entity : entities) {
            String entityId = entityId(entity);
            ProgressTracker<I> tracker;
            List<I> candidates;
            try {
                tracker = openTracker(entity);
                candidates = fetchCandidates(entity);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{}: interrupted while fetching candidates for {}", name(), entityId);
                failedEntities++;
                break;
            } catch (Exception e) {
                log.warn("{}: failed to fetch candidates for {}: {}", name(), entityId, e.getMessage(), e);
                failedEntities++;
                continue;
            }
            for (I item : candidates) {
                if (!tracker.accepts(item)) {
                    skipped++;
                    continue;
                }
                try {
                    process(entity, item);
                    tracker.succeeded(item);
                    processed++;
                } catch (Exception e) {
                    if (e instanceof InterruptedException) {
                        Thread.currentThread().interrupt();
                    }
                    log.warn("{}: failed to process item {} for {}: {}",
                            name(), itemId(item), entityId, e.getMessage(), e);
                    tracker.failed(item);
                    failed++;
                }
            }
            try {
                tracker.commit();
            } catch (Exception e) {
                log.warn("{}: failed to persist progress for {}: {}", name(), entityId, e.getMessage(), e);
                failedEntities++;
            }
        }
        PollSummary summary = new PollSummary(entities.size(), failedEntities, processed, skipped, failed);
        log.info("{}: pass complete {}", name(), summary);
        return summary;
    }
}
