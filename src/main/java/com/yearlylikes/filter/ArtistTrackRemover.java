package com.yearlylikes.filter;

import com.yearlylikes.paging.Page;
import com.yearlylikes.processor.Processor;
import com.yearlylikes.processor.ProcessorException;
import com.yearlylikes.processor.RunContext;
import com.yearlylikes.spotify.LibraryClient;
import com.yearlylikes.spotify.LikedTrack;
import com.yearlylikes.spotify.SpotifyClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Removes liked songs by blocked artists from the library, one page at a time.
 * <p>
 * Each page's matches are removed right after the page is read. A failed removal is logged and
 * the run moves on to the next page; only failing to read a page stops the run.
 */
public class ArtistTrackRemover implements Processor<RemovalReport> {

    /** Also Spotify's limit for a single library removal call. */
    static final int PAGE_SIZE = 50;

    private static final Logger log = LoggerFactory.getLogger(ArtistTrackRemover.class);

    private final LibraryClient library;
    private final Blocklist blocklist;
    private final PagingMode pagingMode;

    public ArtistTrackRemover(LibraryClient library, Blocklist blocklist) {
        this(library, blocklist, PagingMode.COMPENSATED);
    }

    public ArtistTrackRemover(LibraryClient library, Blocklist blocklist, PagingMode pagingMode) {
        this.library = Objects.requireNonNull(library, "library");
        this.blocklist = Objects.requireNonNull(blocklist, "blocklist");
        this.pagingMode = Objects.requireNonNull(pagingMode, "pagingMode");
    }

    @Override
    public RemovalReport run(RunContext context) throws ProcessorException {
        log.info("Starting artist track removal process ({} blocked artist(s), {} paging)...", blocklist.size(), pagingMode);

        Set<String> removedIds = new HashSet<>();
        int offset = 0;
        int total = -1;
        int pages = 0;
        int scanned = 0;
        int marked = 0;
        int failedPages = 0;

        while (true) {
            context.checkpoint();
            log.info("Fetching liked songs page (offset: {})...", offset);
            Page<LikedTrack> page;
            try {
                page = library.listLikedTracks(offset, PAGE_SIZE);
            } catch (SpotifyClientException e) {
                throw new ProcessorException("couldn't get liked songs page at offset " + offset + ": " + e.getMessage(), e);
            }

            if (total == -1) {
                total = page.total();
                log.info("Found {} total liked songs to process.", total);
            } else if (pagingMode == PagingMode.COMPENSATED) {
                total = page.total();
            }

            if (page.isEmpty()) {
                log.info("No more liked songs found. Task complete.");
                break;
            }
            pages++;
            scanned += page.size();

            List<String> toRemove = findTracksToRemove(page.items(), removedIds);
            int removedNow = 0;
            if (!toRemove.isEmpty()) {
                marked += toRemove.size();
                context.checkpoint();
                log.info("Attempting to remove {} track(s) from this page.", toRemove.size());
                try {
                    library.removeFromLibrary(toRemove);
                    removedIds.addAll(toRemove);
                    removedNow = toRemove.size();
                    log.info("Batch removal successful.");
                } catch (SpotifyClientException e) {
                    failedPages++;
                    log.warn("Failed to remove a batch of tracks: {}", e.getMessage());
                }
            } else {
                log.info("No tracks matching criteria on this page.");
            }

            if (pagingMode == PagingMode.COMPENSATED) {
                offset += page.size() - removedNow;
                total -= removedNow;
            } else {
                offset += PAGE_SIZE;
            }
            if (offset >= total) {
                log.info("All songs have been processed. Task complete.");
                break;
            }
        }

        RemovalReport report = new RemovalReport(pages, scanned, marked, removedIds.size(), failedPages);
        log.info("Removed {} of {} marked track(s) across {} page(s), {} failed page(s).",
                report.tracksRemoved(), report.tracksMarked(), report.pagesScanned(), report.failedPages());
        return report;
    }

    /**
     * Ids on this page with at least one blocked artist. Ids already removed earlier in the run are
     * not marked again, so a lagging server cannot make the compensated offset stall.
     */
    List<String> findTracksToRemove(List<LikedTrack> tracks, Set<String> alreadyRemoved) {
        List<String> ids = new ArrayList<>();
        for (LikedTrack track : tracks) {
            if (track.id() == null || track.id().isBlank() || alreadyRemoved.contains(track.id())) {
                continue;
            }
            String artist = blocklist.firstMatch(track.artists());
            if (artist != null) {
                log.info("  [MARK] '{}' by {}", track.name(), artist);
                ids.add(track.id());
            }
        }
        return ids;
    }
}
