package com.yearlylikes.spotify;

import com.yearlylikes.paging.Page;

import java.util.List;

/**
 * Playlist listing and mutation.
 */
public interface PlaylistClient {

    Page<PlaylistRef> listUserPlaylists(String userId, int offset, int limit) throws SpotifyClientException;

    PlaylistRef createPlaylist(String userId, String name, String description, boolean isPublic, boolean collaborative)
            throws SpotifyClientException;

    Page<PlaylistItem> listPlaylistTracks(String playlistId, int offset, int limit) throws SpotifyClientException;

    /** Adds at most 100 tracks. */
    void addToPlaylist(String playlistId, List<String> trackIds) throws SpotifyClientException;

    /** Removes at most 100 tracks, every occurrence of each. */
    void removeFromPlaylist(String playlistId, List<String> trackIds) throws SpotifyClientException;
}
