package com.yearlylikes.spotify;

/**
 * An entry of a playlist.
 *
 * @param trackId the track id, or null when the entry is not a playable track
 *                (local file, podcast episode, track removed from the catalog)
 */
public record PlaylistItem(String trackId) {

    public boolean hasTrackId() {
        return trackId != null && !trackId.isBlank();
    }
}
