package com.yearlylikes.sorter;

import com.yearlylikes.paging.Pager;
import com.yearlylikes.processor.RunCancelledException;
import com.yearlylikes.spotify.PlaylistClient;
import com.yearlylikes.spotify.PlaylistRef;
import com.yearlylikes.spotify.SpotifyClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Finds a playlist by exact name among the ones owned by a user.
 * <p>
 * Names are compared byte for byte: a manually renamed playlist counts as a different playlist.
 * Playlists of other users that show up in the list (followed ones) never match.
 */
public class PlaylistLocator {

    static final int PAGE_SIZE = 50;
    private static final Logger log = LoggerFactory.getLogger(PlaylistLocator.class);

    private final PlaylistClient playlists;

    public PlaylistLocator(PlaylistClient playlists) {
        this.playlists = playlists;
    }

    public Optional<PlaylistRef> locate(Pager pager, String ownerId, String name)
            throws SpotifyClientException, RunCancelledException {
        log.info("Searching for existing playlist named '{}'...", name);
        Optional<PlaylistRef> found = pager.findFirst(
                (offset, limit) -> playlists.listUserPlaylists(ownerId, offset, limit),
                PAGE_SIZE,
                playlist -> playlist.matches(name, ownerId));
        if (found.isPresent()) {
            log.info("Found existing playlist: '{}' (ID: {})", found.get().name(), found.get().id());
        } else {
            log.info("No existing playlist found.");
        }
        return found;
    }
}
