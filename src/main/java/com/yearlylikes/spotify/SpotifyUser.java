package com.yearlylikes.spotify;

public record SpotifyUser(String id, String displayName) {
}
