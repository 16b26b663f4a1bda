package com.yearlylikes.sorter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Liked track ids grouped by the calendar year they were added.
 * Within a year ids keep the order they were fetched in.
 */
public final class YearBuckets {

    private final SortedMap<Integer, List<String>> byYear;
    private final List<SkippedTrack> skipped;

    YearBuckets(SortedMap<Integer, List<String>> byYear, List<SkippedTrack> skipped) {
        SortedMap<Integer, List<String>> copy = new TreeMap<>();
        byYear.forEach((year, ids) -> copy.put(year, List.copyOf(ids)));
        this.byYear = Collections.unmodifiableSortedMap(copy);
        this.skipped = List.copyOf(skipped);
    }

    /** Distinct years in ascending order. */
    public List<Integer> years() {
        return new ArrayList<>(byYear.keySet());
    }

    public List<String> trackIds(int year) {
        return byYear.getOrDefault(year, List.of());
    }

    public Map<Integer, List<String>> asMap() {
        return new LinkedHashMap<>(byYear);
    }

    public boolean isEmpty() {
        return byYear.isEmpty();
    }

    public int trackCount() {
        return byYear.values().stream().mapToInt(List::size).sum();
    }

    public List<SkippedTrack> skipped() {
        return skipped;
    }

    /**
     * A liked track left out of every bucket.
     */
    public record SkippedTrack(String trackId, String name, String addedAt, String reason) {}
}
