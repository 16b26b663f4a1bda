package com.yearlylikes.paging;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits id lists into chunks that fit a remote call's item limit.
 */
public final class Batcher {

    /** Spotify accepts at most 100 items per playlist add/remove call. */
    public static final int PLAYLIST_MUTATION_LIMIT = 100;

    private Batcher() {}

    /**
     * Partitions {@code items} into consecutive batches of at most {@code batchSize} elements.
     * The returned batches are views over the input list; do not modify the input while they are in use.
     */
    public static <T> List<List<T>> partition(List<T> items, int batchSize) {
        Objects.requireNonNull(items, "items");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
        }
        List<List<T>> batches = new ArrayList<>((items.size() + batchSize - 1) / batchSize);
        for (int i = 0; i < items.size(); i += batchSize) {
            int end = Math.min(i + batchSize, items.size());
            batches.add(items.subList(i, end));
        }
        return batches;
    }
}
