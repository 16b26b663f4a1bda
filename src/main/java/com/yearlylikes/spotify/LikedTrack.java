package com.yearlylikes.spotify;

import java.util.List;

/**
 * A saved track from the user's library.
 *
 * @param addedAt ISO-8601 timestamp of when the track was liked, may be null if Spotify omitted it
 */
public record LikedTrack(String id, String name, List<String> artists, String addedAt) {

    public LikedTrack {
        artists = (artists == null) ? List.of() : List.copyOf(artists);
    }
}
