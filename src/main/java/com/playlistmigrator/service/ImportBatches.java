package com.playlistmigrator.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits playlist additions into provider-sized batches.
 */
public final class ImportBatches {

    /** Largest number of items observed to be accepted by a single add-to-playlist call. */
    public static final int DEFAULT_BATCH_SIZE = 100;

    private ImportBatches() {
    }

    /**
     * @param items     The items to add, in order.
     * @param batchSize The maximum batch size, must be positive.
     * @return Consecutive sublists of at most {@code batchSize} items, preserving order.
     */
    public static <T> List<List<T>> partition(List<T> items, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        List<List<T>> batches = new ArrayList<>();
        for (int start = 0; start < items.size(); start += batchSize) {
            int end = Math.min(start + batchSize, items.size());
            batches.add(List.copyOf(items.subList(start, end)));
        }
        return batches;
    }
}
