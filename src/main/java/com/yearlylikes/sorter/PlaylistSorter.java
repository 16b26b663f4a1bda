package com.yearlylikes.sorter;

import com.yearlylikes.image.CoverImageGenerator;
import com.yearlylikes.paging.Batcher;
import com.yearlylikes.paging.Pager;
import com.yearlylikes.processor.Processor;
import com.yearlylikes.processor.RunCancelledException;
import com.yearlylikes.processor.RunContext;
import com.yearlylikes.spotify.LibraryClient;
import com.yearlylikes.spotify.LikedTrack;
import com.yearlylikes.spotify.PlaylistClient;
import com.yearlylikes.spotify.PlaylistImageClient;
import com.yearlylikes.spotify.PlaylistItem;
import com.yearlylikes.spotify.PlaylistRef;
import com.yearlylikes.spotify.SpotifyClientException;
import com.yearlylikes.spotify.SpotifyUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Sorts liked songs into one playlist per year they were added in.
 * <p>
 * Years are processed in ascending order. For each year the playlist "Liked Songs (YYYY)" is
 * located or created, emptied, given a generated cover and refilled with that year's tracks.
 * Any remote failure other than the cover stops the whole run, leaving the current and later
 * years untouched; the run can simply be repeated.
 */
public class PlaylistSorter implements Processor<SortReport> {

    static final int LIKED_PAGE_SIZE = 50;
    static final int PLAYLIST_ITEMS_PAGE_SIZE = 100;

    private static final Logger log = LoggerFactory.getLogger(PlaylistSorter.class);

    private final LibraryClient library;
    private final PlaylistClient playlists;
    private final PlaylistImageClient images;
    private final CoverImageGenerator coverGenerator;
    private final TrackClassifier classifier;
    private final PlaylistLocator locator;

    public PlaylistSorter(LibraryClient library,
                          PlaylistClient playlists,
                          PlaylistImageClient images,
                          CoverImageGenerator coverGenerator) {
        this.library = library;
        this.playlists = playlists;
        this.images = images;
        this.coverGenerator = coverGenerator;
        this.classifier = new TrackClassifier();
        this.locator = new PlaylistLocator(playlists);
    }

    public static String playlistName(int year) {
        return "Liked Songs (" + year + ")";
    }

    static String playlistDescription(int year) {
        return "All songs I liked that were added in " + year + ".";
    }

    @Override
    public SortReport run(RunContext context) throws PlaylistSortException {
        log.info("Starting liked songs sorter...");
        Pager pager = new Pager(context);

        List<LikedTrack> likedTracks;
        try {
            likedTracks = pager.fetchAll("liked songs", library::listLikedTracks, LIKED_PAGE_SIZE);
        } catch (SpotifyClientException | RunCancelledException e) {
            throw new PlaylistSortException(null, SortStage.FETCH, "failed to fetch liked tracks: " + e.getMessage(), e);
        }
        log.info("Total liked songs fetched: {}", likedTracks.size());
        if (likedTracks.isEmpty()) {
            log.info("No liked tracks found. Nothing to do.");
            return new SortReport(0, 0, List.of());
        }

        YearBuckets buckets = classifier.classify(likedTracks);

        SpotifyUser user;
        try {
            context.checkpoint();
            user = library.currentUser();
        } catch (SpotifyClientException | RunCancelledException e) {
            throw new PlaylistSortException(null, SortStage.FETCH, "failed to get current user: " + e.getMessage(), e);
        }

        List<Integer> years = buckets.years();
        log.info("Found songs spanning {} years: {}", years.size(), years);

        List<SortReport.YearResult> results = new ArrayList<>(years.size());
        for (int year : years) {
            results.add(sortYear(pager, context, user.id(), year, buckets.trackIds(year)));
        }
        return new SortReport(likedTracks.size(), buckets.skipped().size(), results);
    }

    private SortReport.YearResult sortYear(Pager pager, RunContext context, String userId, int year, List<String> trackIds)
            throws PlaylistSortException {
        String name = playlistName(year);
        log.info("--- Processing year {} ({} tracks) ---", year, trackIds.size());

        Optional<PlaylistRef> existing;
        try {
            existing = locator.locate(pager, userId, name);
        } catch (SpotifyClientException | RunCancelledException e) {
            throw new PlaylistSortException(year, SortStage.LOCATE, "could not search for playlist '" + name + "': " + e.getMessage(), e);
        }

        String playlistId;
        boolean created;
        int removed;
        if (existing.isPresent()) {
            playlistId = existing.get().id();
            created = false;
            log.info("Found existing playlist: '{}'. Clearing it now.", name);
            removed = clear(pager, context, year, name, playlistId);
        } else {
            playlistId = create(context, year, userId, name);
            created = true;
            removed = 0;
        }

        boolean imageApplied = applyCover(context, year, name, playlistId);
        int added = fill(context, year, name, playlistId, trackIds);

        return new SortReport.YearResult(year, playlistId, name, created, removed, added, imageApplied);
    }

    private String create(RunContext context, int year, String userId, String name) throws PlaylistSortException {
        try {
            context.checkpoint();
            PlaylistRef playlist = playlists.createPlaylist(userId, name, playlistDescription(year), false, false);
            log.info("Created new playlist: '{}'", playlist.name());
            return playlist.id();
        } catch (SpotifyClientException | RunCancelledException e) {
            throw new PlaylistSortException(year, SortStage.CREATE, "failed to create playlist '" + name + "': " + e.getMessage(), e);
        }
    }

    private int clear(Pager pager, RunContext context, int year, String name, String playlistId) throws PlaylistSortException {
        List<PlaylistItem> items;
        try {
            items = pager.fetchAll("existing tracks from playlist",
                    (offset, limit) -> playlists.listPlaylistTracks(playlistId, offset, limit),
                    PLAYLIST_ITEMS_PAGE_SIZE);
        } catch (SpotifyClientException | RunCancelledException e) {
            throw new PlaylistSortException(year, SortStage.CLEAR, "could not fetch tracks from existing playlist '" + name + "': " + e.getMessage(), e);
        }

        // a remove call drops every occurrence of an id
        LinkedHashSet<String> distinct = new LinkedHashSet<>();
        for (PlaylistItem item : items) {
            if (item.hasTrackId()) {
                distinct.add(item.trackId());
            }
        }
        if (distinct.isEmpty()) {
            log.info("Playlist is already empty. No tracks to remove.");
            return 0;
        }

        List<String> toRemove = new ArrayList<>(distinct);
        try {
            for (List<String> batch : Batcher.partition(toRemove, Batcher.PLAYLIST_MUTATION_LIMIT)) {
                context.checkpoint();
                log.info("  Removing batch of {} tracks...", batch.size());
                playlists.removeFromPlaylist(playlistId, batch);
            }
        } catch (SpotifyClientException | RunCancelledException e) {
            throw new PlaylistSortException(year, SortStage.CLEAR, "could not clear existing playlist '" + name + "': " + e.getMessage(), e);
        }
        log.info("Finished removing all {} old tracks.", toRemove.size());
        return toRemove.size();
    }

    private boolean applyCover(RunContext context, int year, String name, String playlistId) throws PlaylistSortException {
        try {
            context.checkpoint();
        } catch (RunCancelledException e) {
            throw new PlaylistSortException(year, SortStage.IMAGE, e.getMessage(), e);
        }
        log.info("Generating custom cover image...");
        byte[] jpeg;
        try {
            jpeg = coverGenerator.generateForPlaylist(name);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not generate image for '{}': {}", name, e.getMessage());
            return false;
        }
        try {
            images.setPlaylistImage(playlistId, jpeg);
        } catch (SpotifyClientException e) {
            log.warn("Could not upload cover image for '{}': {}", name, e.getMessage());
            return false;
        }
        log.info("Custom cover image uploaded.");
        return true;
    }

    private int fill(RunContext context, int year, String name, String playlistId, List<String> trackIds)
            throws PlaylistSortException {
        try {
            for (List<String> batch : Batcher.partition(trackIds, Batcher.PLAYLIST_MUTATION_LIMIT)) {
                context.checkpoint();
                log.info("  Adding batch of {} tracks...", batch.size());
                playlists.addToPlaylist(playlistId, batch);
            }
        } catch (SpotifyClientException | RunCancelledException e) {
            throw new PlaylistSortException(year, SortStage.FILL, "failed to add tracks to playlist '" + name + "': " + e.getMessage(), e);
        }
        log.info("Finished adding all {} tracks.", trackIds.size());
        return trackIds.size();
    }
}
