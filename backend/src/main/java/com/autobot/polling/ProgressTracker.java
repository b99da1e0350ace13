package com.autobot.polling;

/**
 * Per-entity, per-pass progress bookkeeping for {@link IncrementalPoller}. A new tracker is opened for
 * every entity on every pass.
 */
public interface ProgressTracker<I> {

    /** Whether the item still needs processing (e.g. it lies after the stored cursor). */
    boolean accepts(I item);

    void succeeded(I item);

    void failed(I item);

    /** Persists whatever progress the pass made for this entity. */
    void commit();

    /** Tracker for pollers whose progress lives in the items themselves. */
    static <I> ProgressTracker<I> acceptAll() {
        return new ProgressTracker<>() {
            @Override
            public boolean accepts(I item) {
                return true;
            }

            @Override
            public void succeeded(I item) {
            }

            @Override
            public void failed(I item) {
            }

            @Override
            public void commit() {
            }
        };
    }
}
