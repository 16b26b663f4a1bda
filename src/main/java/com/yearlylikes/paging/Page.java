package com.yearlylikes.paging;

import java.util.List;

/**
 * One page of a remote collection as returned by Spotify.
 *
 * @param items the items on this page, never null
 * @param total the total reported by the server; may be stale while the collection is being modified
 */
public record Page<T>(List<T> items, int total) {

    public Page {
        items = (items == null) ? List.of() : List.copyOf(items);
    }

    public static <T> Page<T> empty() {
        return new Page<>(List.of(), 0);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }
}
