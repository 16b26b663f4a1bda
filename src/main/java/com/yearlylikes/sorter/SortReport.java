package com.yearlylikes.sorter;

import java.util.List;

/**
 * Outcome of a completed sorter run.
 */
public record SortReport(int likedTracks, int skippedTracks, List<YearResult> years) {

    public SortReport {
        years = List.copyOf(years);
    }

    public record YearResult(
            int year,
            String playlistId,
            String playlistName,
            boolean created,
            int removedCount,
            int addedCount,
            boolean imageApplied
    ) {}
}
