package com.yearlylikes.spotify;

public interface PlaylistImageClient {

    /** Uploads a JPEG as the playlist's custom cover. */
    void setPlaylistImage(String playlistId, byte[] jpeg) throws SpotifyClientException;
}
