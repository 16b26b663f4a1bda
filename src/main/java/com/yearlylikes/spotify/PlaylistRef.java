package com.yearlylikes.spotify;

public record PlaylistRef(String id, String name, String ownerId) {

    /** Exact, case-sensitive name match owned by {@code userId}. */
    public boolean matches(String playlistName, String userId) {
        return name != null && name.equals(playlistName)
                && ownerId != null && ownerId.equals(userId);
    }
}
