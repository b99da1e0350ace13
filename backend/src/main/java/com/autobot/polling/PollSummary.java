package com.autobot.polling;

/**
 * Counters for one poller pass.
 */
public record PollSummary(int entities, int failedEntities, int processedItems, int skippedItems, int failedItems) {
}
