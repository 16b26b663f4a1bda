package com.yearlylikes.spotify;

import com.yearlylikes.paging.Page;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory stand-in for the Spotify account used by processor tests. Records every mutation.
 */
public class InMemorySpotify implements LibraryClient, PlaylistClient, PlaylistImageClient {

    public static final String USER_ID = "me";

    private final List<LikedTrack> liked = new ArrayList<>();
    private final Map<String, PlaylistRef> playlists = new LinkedHashMap<>();
    private final Map<String, List<PlaylistItem>> playlistItems = new HashMap<>();
    private final Map<String, Integer> failuresLeft = new HashMap<>();
    private final Set<String> alwaysFail = new HashSet<>();
    private int nextPlaylistId = 1;

    public final List<String> calls = new ArrayList<>();
    public final List<List<String>> libraryRemovals = new ArrayList<>();
    public final List<List<String>> playlistRemovals = new ArrayList<>();
    public final List<List<String>> playlistAdditions = new ArrayList<>();
    public final List<String> createdPlaylists = new ArrayList<>();
    public final Map<String, byte[]> images = new HashMap<>();
    public final List<Integer> likedOffsetsRead = new ArrayList<>();
    public int playlistPagesRead;

    // =========================================================================
    // Setup
    // =========================================================================

    public InMemorySpotify like(String id, String addedAt, String... artists) {
        liked.add(new LikedTrack(id, "Track " + id, Arrays.asList(artists), addedAt));
        return this;
    }

    public PlaylistRef addPlaylist(String name, String ownerId, String... trackIds) {
        String id = "pl" + nextPlaylistId++;
        PlaylistRef ref = new PlaylistRef(id, name, ownerId);
        playlists.put(id, ref);
        List<PlaylistItem> items = new ArrayList<>();
        for (String trackId : trackIds) {
            items.add(new PlaylistItem(trackId));
        }
        playlistItems.put(id, items);
        return ref;
    }

    public void addUnavailableItem(String playlistId) {
        playlistItems.get(playlistId).add(new PlaylistItem(null));
    }

    /** The next {@code times} calls of {@code operation} fail. */
    public void failNext(String operation, int times) {
        failuresLeft.put(operation, times);
    }

    public void failAlways(String operation) {
        alwaysFail.add(operation);
    }

    // =========================================================================
    // Inspection
    // =========================================================================

    public List<String> likedIds() {
        return liked.stream().map(LikedTrack::id).toList();
    }

    public List<String> trackIdsOf(String playlistId) {
        return playlistItems.get(playlistId).stream().map(PlaylistItem::trackId).toList();
    }

    public PlaylistRef playlistNamed(String name) {
        return playlists.values().stream().filter(p -> p.name().equals(name)).findFirst().orElse(null);
    }

    public int playlistCount() {
        return playlists.size();
    }

    // =========================================================================
    // LibraryClient
    // =========================================================================

    @Override
    public SpotifyUser currentUser() throws SpotifyClientException {
        maybeFail("currentUser");
        return new SpotifyUser(USER_ID, "Test User");
    }

    @Override
    public Page<LikedTrack> listLikedTracks(int offset, int limit) throws SpotifyClientException {
        maybeFail("listLikedTracks");
        likedOffsetsRead.add(offset);
        return slice(liked, offset, limit);
    }

    @Override
    public void removeFromLibrary(List<String> trackIds) throws SpotifyClientException {
        calls.add("removeFromLibrary");
        maybeFail("removeFromLibrary");
        libraryRemovals.add(List.copyOf(trackIds));
        Set<String> ids = new HashSet<>(trackIds);
        liked.removeIf(t -> ids.contains(t.id()));
    }

    // =========================================================================
    // PlaylistClient
    // =========================================================================

    @Override
    public Page<PlaylistRef> listUserPlaylists(String userId, int offset, int limit) throws SpotifyClientException {
        maybeFail("listUserPlaylists");
        playlistPagesRead++;
        return slice(new ArrayList<>(playlists.values()), offset, limit);
    }

    @Override
    public PlaylistRef createPlaylist(String userId, String name, String description, boolean isPublic, boolean collaborative)
            throws SpotifyClientException {
        calls.add("createPlaylist:" + name);
        maybeFail("createPlaylist");
        createdPlaylists.add(name);
        return addPlaylist(name, userId);
    }

    @Override
    public Page<PlaylistItem> listPlaylistTracks(String playlistId, int offset, int limit) throws SpotifyClientException {
        maybeFail("listPlaylistTracks");
        return slice(playlistItems.get(playlistId), offset, limit);
    }

    @Override
    public void addToPlaylist(String playlistId, List<String> trackIds) throws SpotifyClientException {
        calls.add("addToPlaylist:" + playlistId);
        maybeFail("addToPlaylist");
        requireAtMost(trackIds, 100);
        playlistAdditions.add(List.copyOf(trackIds));
        for (String id : trackIds) {
            playlistItems.get(playlistId).add(new PlaylistItem(id));
        }
    }

    @Override
    public void removeFromPlaylist(String playlistId, List<String> trackIds) throws SpotifyClientException {
        calls.add("removeFromPlaylist:" + playlistId);
        maybeFail("removeFromPlaylist");
        requireAtMost(trackIds, 100);
        playlistRemovals.add(List.copyOf(trackIds));
        Set<String> ids = new HashSet<>(trackIds);
        playlistItems.get(playlistId).removeIf(item -> ids.contains(item.trackId()));
    }

    // =========================================================================
    // PlaylistImageClient
    // =========================================================================

    @Override
    public void setPlaylistImage(String playlistId, byte[] jpeg) throws SpotifyClientException {
        calls.add("setPlaylistImage:" + playlistId);
        maybeFail("setPlaylistImage");
        images.put(playlistId, jpeg);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void maybeFail(String operation) throws SpotifyClientException {
        if (alwaysFail.contains(operation)) {
            throw new SpotifyClientException("simulated failure of " + operation, 500, null);
        }
        Integer left = failuresLeft.get(operation);
        if (left != null && left > 0) {
            failuresLeft.put(operation, left - 1);
            throw new SpotifyClientException("simulated failure of " + operation, 500, null);
        }
    }

    private static void requireAtMost(List<String> ids, int max) {
        if (ids.size() > max) {
            throw new IllegalArgumentException("batch of " + ids.size() + " exceeds " + max);
        }
    }

    private static <T> Page<T> slice(List<T> all, int offset, int limit) {
        if (offset >= all.size()) {
            return new Page<>(List.of(), all.size());
        }
        int end = Math.min(all.size(), offset + limit);
        return new Page<>(new ArrayList<>(all.subList(offset, end)), all.size());
    }
}
