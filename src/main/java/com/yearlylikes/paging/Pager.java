package com.yearlylikes.paging;

import com.yearlylikes.processor.RunCancelledException;
import com.yearlylikes.processor.RunContext;
import com.yearlylikes.spotify.SpotifyClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Walks an offset/limit paginated Spotify collection.
 * <p>
 * An empty page ends the walk regardless of the reported total, since the total can be stale
 * while the collection is being modified. Errors from the fetcher are propagated as-is; retrying
 * is left to the client.
 */
public class Pager {

    private static final Logger log = LoggerFactory.getLogger(Pager.class);

    private final RunContext context;

    public Pager(RunContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * Fetches every page and returns the items in server order.
     *
     * @param what label used in progress logging, e.g. "liked songs"
     */
    public <T> List<T> fetchAll(String what, PageFetcher<T> fetcher, int limit)
            throws SpotifyClientException, RunCancelledException {
        requirePositive(limit);
        List<T> all = new ArrayList<>();
        int offset = 0;
        while (true) {
            context.checkpoint();
            Page<T> page = fetcher.fetch(offset, limit);
            if (page == null || page.isEmpty()) {
                break;
            }
            all.addAll(page.items());
            log.info("Fetched {}/{} {}...", all.size(), page.total(), what);
            offset += page.size();
        }
        log.debug("Total {} fetched: {}", what, all.size());
        return all;
    }

    /**
     * Returns the first item matching {@code predicate} in page order, reading no further pages once found.
     */
    public <T> Optional<T> findFirst(PageFetcher<T> fetcher, int limit, Predicate<? super T> predicate)
            throws SpotifyClientException, RunCancelledException {
        requirePositive(limit);
        int offset = 0;
        while (true) {
            context.checkpoint();
            Page<T> page = fetcher.fetch(offset, limit);
            if (page == null || page.isEmpty()) {
                return Optional.empty();
            }
            for (T item : page.items()) {
                if (predicate.test(item)) {
                    return Optional.of(item);
                }
            }
            offset += page.size();
        }
    }

    private static void requirePositive(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, was " + limit);
        }
    }
}
