package com.yearlylikes.sorter;

import com.yearlylikes.spotify.LikedTrack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Buckets liked tracks by the year of their "added" timestamp.
 * <p>
 * The year is taken in the timestamp's own offset. Tracks with a missing id or an unparseable
 * timestamp are skipped and reported, they never abort the run.
 */
public class TrackClassifier {

    private static final Logger log = LoggerFactory.getLogger(TrackClassifier.class);

    public YearBuckets classify(List<LikedTrack> tracks) {
        SortedMap<Integer, List<String>> byYear = new TreeMap<>();
        List<YearBuckets.SkippedTrack> skipped = new ArrayList<>();

        for (LikedTrack track : tracks) {
            if (track.id() == null || track.id().isBlank()) {
                log.info("Skipping liked item without a track id: '{}'", track.name());
                skipped.add(new YearBuckets.SkippedTrack(track.id(), track.name(), track.addedAt(), "missing track id"));
                continue;
            }
            Integer year = yearOf(track.addedAt());
            if (year == null) {
                log.warn("Error parsing added date '{}' for '{}', skipping", track.addedAt(), track.name());
                skipped.add(new YearBuckets.SkippedTrack(track.id(), track.name(), track.addedAt(), "unparseable added date"));
                continue;
            }
            byYear.computeIfAbsent(year, y -> new ArrayList<>()).add(track.id());
        }

        if (!skipped.isEmpty()) {
            log.info("{} liked track(s) could not be classified", skipped.size());
        }
        return new YearBuckets(byYear, skipped);
    }

    static Integer yearOf(String addedAt) {
        if (addedAt == null || addedAt.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(addedAt.trim()).getYear();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
