package com.autobot.polling;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Cursor-based progress: accepts items whose key is strictly after the starting watermark and, on
 * commit, advances the watermark to the furthest successful key that does not pass a failed item.
 *
 * @param <I> item type
 * @param <K> ordering key (date, block height)
 */
public class WatermarkTracker<I, K extends Comparable<K>> implements ProgressTracker<I> {

    private final String entityId;
    private final K start;
    private final Function<I, K> keyOf;
    private final BiConsumer<String, K> writer;
    private final List<K> succeededKeys = new ArrayList<>();
    private K minFailedKey;

    /**
     * @param start  stored watermark, or null when the entity has none yet (treated as earliest)
     * @param writer persists a new watermark for the entity; only called when it moves forward
     */
    public WatermarkTracker(String entityId, K start, Function<I, K> keyOf, BiConsumer<String, K> writer) {
        this.entityId = entityId;
        this.start = start;
        this.keyOf = keyOf;
        this.writer = writer;
    }

    @Override
    public boolean accepts(I item) {
        K key = keyOf.apply(item);
        return key != null && (start == null || key.compareTo(start) > 0);
    }

    @Override
    public void succeeded(I item) {
        succeededKeys.add(keyOf.apply(item));
    }

    @Override
    public void failed(I item) {
        K key = keyOf.apply(item);
        if (key != null && (minFailedKey == null || key.compareTo(minFailedKey) < 0)) {
            minFailedKey = key;
        }
    }

    /**
     * Largest successful key strictly below the smallest failed key, if it lies after the start.
     */
    public Optional<K> nextWatermark() {
        K best = null;
        for (K key : succeededKeys) {
            if (minFailedKey != null && key.compareTo(minFailedKey) >= 0) {
                continue;
            }
            if (best == null || key.compareTo(best) > 0) {
                best = key;
            }
        }
        if (best == null || (start != null && best.compareTo(start) <= 0)) {
            return Optional.empty();
        }
        return Optional.of(best);
    }

    @Override
    public void commit() {
        nextWatermark().ifPresent(next -> writer.accept(entityId, next));
    }

    public K getStart() {
        return start;
    }
}
