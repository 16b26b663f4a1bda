package com.yearlylikes.spotify;

import com.yearlylikes.paging.Page;

import java.util.List;

/**
 * The user's profile and saved-tracks library.
 */
public interface LibraryClient {

    SpotifyUser currentUser() throws SpotifyClientException;

    Page<LikedTrack> listLikedTracks(int offset, int limit) throws SpotifyClientException;

    /** Removes at most 50 tracks from the library in one call. */
    void removeFromLibrary(List<String> trackIds) throws SpotifyClientException;
}
