package com.yearlylikes.spotify;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.yearlylikes.paging.Page;
import org.apache.hc.core5.http.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.michaelthelin.spotify.SpotifyApi;
import se.michaelthelin.spotify.SpotifyHttpManager;
import se.michaelthelin.spotify.exceptions.SpotifyWebApiException;
import se.michaelthelin.spotify.exceptions.detailed.BadGatewayException;
import se.michaelthelin.spotify.exceptions.detailed.BadRequestException;
import se.michaelthelin.spotify.exceptions.detailed.ForbiddenException;
import se.michaelthelin.spotify.exceptions.detailed.InternalServerErrorException;
import se.michaelthelin.spotify.exceptions.detailed.NotFoundException;
import se.michaelthelin.spotify.exceptions.detailed.ServiceUnavailableException;
import se.michaelthelin.spotify.exceptions.detailed.TooManyRequestsException;
import se.michaelthelin.spotify.exceptions.detailed.UnauthorizedException;
import se.michaelthelin.spotify.model_objects.IPlaylistItem;
import se.michaelthelin.spotify.model_objects.specification.ArtistSimplified;
import se.michaelthelin.spotify.model_objects.specification.Episode;
import se.michaelthelin.spotify.model_objects.specification.Paging;
import se.michaelthelin.spotify.model_objects.specification.Playlist;
import se.michaelthelin.spotify.model_objects.specification.PlaylistSimplified;
import se.michaelthelin.spotify.model_objects.specification.PlaylistTrack;
import se.michaelthelin.spotify.model_objects.specification.SavedTrack;
import se.michaelthelin.spotify.model_objects.specification.Track;
import se.michaelthelin.spotify.model_objects.specification.User;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;

/**
 * Spotify Web API implementation of the library, playlist and image capabilities.
 */
public class SpotifyWebApiGateway implements LibraryClient, PlaylistClient, PlaylistImageClient {

    private static final Logger log = LoggerFactory.getLogger(SpotifyWebApiGateway.class);

    static final int MAX_LIBRARY_REMOVE = 50;
    static final int MAX_PLAYLIST_MUTATION = 100;
    static final int MAX_COVER_IMAGE_BYTES = 256 * 1024;
    private static final String TRACK_URI_PREFIX = "spotify:track:";

    private final SpotifyApi spotifyApi;

    public SpotifyWebApiGateway(SpotifyApi spotifyApi) {
        this.spotifyApi = spotifyApi;
    }

    /**
     * HTTP manager whose connect and socket waits are each bounded by {@code timeout},
     * so a stalled request fails instead of outliving the run.
     */
    public static SpotifyHttpManager httpManager(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        int millis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        return new SpotifyHttpManager.Builder()
                .setConnectTimeout(millis)
                .setSocketTimeout(millis)
                .build();
    }

    // =========================================================================
    // Library
    // =========================================================================

    @Override
    public SpotifyUser currentUser() throws SpotifyClientException {
        User user = call("get current user", () -> spotifyApi.getCurrentUsersProfile().build().execute());
        if (user == null || user.getId() == null) {
            throw new SpotifyClientException("Spotify returned no user profile");
        }
        return new SpotifyUser(user.getId(), user.getDisplayName());
    }

    @Override
    public Page<LikedTrack> listLikedTracks(int offset, int limit) throws SpotifyClientException {
        Paging<SavedTrack> paging = call("list liked songs", () -> spotifyApi
                .getUsersSavedTracks()
                .limit(limit)
                .offset(offset)
                .build()
                .execute());
        if (paging == null || paging.getItems() == null) {
            return Page.empty();
        }
        List<LikedTrack> tracks = new ArrayList<>(paging.getItems().length);
        for (SavedTrack saved : paging.getItems()) {
            if (saved == null) continue;
            Track track = saved.getTrack();
            String addedAt = saved.getAddedAt() != null ? saved.getAddedAt().toInstant().toString() : null;
            if (track == null) {
                tracks.add(new LikedTrack(null, null, List.of(), addedAt));
                continue;
            }
            tracks.add(new LikedTrack(track.getId(), track.getName(), artistNames(track.getArtists()), addedAt));
        }
        return new Page<>(tracks, totalOf(paging));
    }

    @Override
    public void removeFromLibrary(List<String> trackIds) throws SpotifyClientException {
        requireBatch(trackIds, MAX_LIBRARY_REMOVE);
        if (trackIds.isEmpty()) return;
        String[] ids = trackIds.toArray(new String[0]);
        call("remove tracks from library", () -> spotifyApi.removeUsersSavedTracks(ids).build().execute());
    }

    // =========================================================================
    // Playlists
    // =========================================================================

    @Override
    public Page<PlaylistRef> listUserPlaylists(String userId, int offset, int limit) throws SpotifyClientException {
        Paging<PlaylistSimplified> paging = call("list playlists of " + userId, () -> spotifyApi
                .getListOfUsersPlaylists(userId)
                .limit(limit)
                .offset(offset)
                .build()
                .execute());
        if (paging == null || paging.getItems() == null) {
            return Page.empty();
        }
        List<PlaylistRef> playlists = new ArrayList<>(paging.getItems().length);
        for (PlaylistSimplified playlist : paging.getItems()) {
            if (playlist == null) continue;
            String ownerId = playlist.getOwner() != null ? playlist.getOwner().getId() : null;
            playlists.add(new PlaylistRef(playlist.getId(), playlist.getName(), ownerId));
        }
        return new Page<>(playlists, totalOf(paging));
    }

    @Override
    public PlaylistRef createPlaylist(String userId, String name, String description, boolean isPublic, boolean collaborative)
            throws SpotifyClientException {
        Playlist created = call("create playlist '" + name + "'", () -> spotifyApi
                .createPlaylist(userId, name)
                .description(description)
                .public_(isPublic)
                .collaborative(collaborative)
                .build()
                .execute());
        if (created == null || created.getId() == null) {
            throw new SpotifyClientException("Spotify returned no playlist for '" + name + "'");
        }
        String ownerId = created.getOwner() != null ? created.getOwner().getId() : userId;
        return new PlaylistRef(created.getId(), created.getName(), ownerId);
    }

    @Override
    public Page<PlaylistItem> listPlaylistTracks(String playlistId, int offset, int limit) throws SpotifyClientException {
        Paging<PlaylistTrack> paging = call("list items of playlist " + playlistId, () -> spotifyApi
                .getPlaylistsItems(playlistId)
                .limit(Math.min(limit, MAX_PLAYLIST_MUTATION))
                .offset(offset)
                .build()
                .execute());
        if (paging == null || paging.getItems() == null) {
            return Page.empty();
        }
        List<PlaylistItem> items = new ArrayList<>(paging.getItems().length);
        for (PlaylistTrack playlistTrack : paging.getItems()) {
            items.add(new PlaylistItem(trackIdOf(playlistTrack)));
        }
        return new Page<>(items, totalOf(paging));
    }

    @Override
    public void addToPlaylist(String playlistId, List<String> trackIds) throws SpotifyClientException {
        requireBatch(trackIds, MAX_PLAYLIST_MUTATION);
        if (trackIds.isEmpty()) return;
        String[] uris = trackIds.stream().map(SpotifyWebApiGateway::toTrackUri).toArray(String[]::new);
        call("add tracks to playlist " + playlistId, () -> spotifyApi
                .addItemsToPlaylist(playlistId, uris)
                .build()
                .execute());
    }

    @Override
    public void removeFromPlaylist(String playlistId, List<String> trackIds) throws SpotifyClientException {
        requireBatch(trackIds, MAX_PLAYLIST_MUTATION);
        if (trackIds.isEmpty()) return;
        JsonArray tracks = new JsonArray();
        for (String id : trackIds) {
            JsonObject track = new JsonObject();
            track.addProperty("uri", toTrackUri(id));
            tracks.add(track);
        }
        call("remove tracks from playlist " + playlistId, () -> spotifyApi
                .removeItemsFromPlaylist(playlistId, tracks)
                .build()
                .execute());
    }

    // =========================================================================
    // Images
    // =========================================================================

    @Override
    public void setPlaylistImage(String playlistId, byte[] jpeg) throws SpotifyClientException {
        if (jpeg == null || jpeg.length == 0) {
            throw new SpotifyClientException("Cover image for playlist " + playlistId + " is empty");
        }
        String encoded = Base64.getEncoder().encodeToString(jpeg);
        if (encoded.length() > MAX_COVER_IMAGE_BYTES) {
            throw new SpotifyClientException("Cover image for playlist " + playlistId + " is "
                    + encoded.length() + " bytes encoded, Spotify accepts at most " + MAX_COVER_IMAGE_BYTES);
        }
        call("upload cover image for playlist " + playlistId, () -> spotifyApi
                .uploadCustomPlaylistCoverImage(playlistId)
                .image_data(encoded)
                .build()
                .execute());
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    static String toTrackUri(String trackId) {
        return trackId.startsWith(TRACK_URI_PREFIX) ? trackId : TRACK_URI_PREFIX + trackId;
    }

    private static String trackIdOf(PlaylistTrack playlistTrack) {
        if (playlistTrack == null) {
            return null;
        }
        if (Boolean.TRUE.equals(playlistTrack.getIsLocal())) {
            log.debug("Skipping local file in playlist");
            return null;
        }
        IPlaylistItem item = playlistTrack.getTrack();
        if (item instanceof Track track) {
            return track.getId();
        }
        if (item instanceof Episode episode) {
            log.debug("Skipping podcast episode: {}", episode.getName());
        } else if (item != null) {
            log.debug("Skipping unknown playlist item type: {}", item.getClass().getName());
        }
        return null;
    }

    private static List<String> artistNames(ArtistSimplified[] artists) {
        if (artists == null) {
            return List.of();
        }
        return Arrays.stream(artists)
                .filter(a -> a != null && a.getName() != null)
                .map(ArtistSimplified::getName)
                .toList();
    }

    private static int totalOf(Paging<?> paging) {
        return paging.getTotal() != null ? paging.getTotal() : 0;
    }

    private static void requireBatch(List<String> ids, int max) {
        if (ids == null) {
            throw new IllegalArgumentException("ids must not be null");
        }
        if (ids.size() > max) {
            throw new IllegalArgumentException("At most " + max + " ids per call, got " + ids.size());
        }
    }

    private static <T> T call(String what, SpotifyCall<T> request) throws SpotifyClientException {
        try {
            return request.execute();
        } catch (SpotifyWebApiException e) {
            throw new SpotifyClientException("Spotify rejected '" + what + "': " + e.getMessage(), statusOf(e), e);
        } catch (IOException | ParseException e) {
            throw new SpotifyClientException("Spotify call '" + what + "' failed: " + e.getMessage(), e);
        }
    }

    static int statusOf(SpotifyWebApiException e) {
        if (e instanceof BadRequestException) return 400;
        if (e instanceof UnauthorizedException) return 401;
        if (e instanceof ForbiddenException) return 403;
        if (e instanceof NotFoundException) return 404;
        if (e instanceof TooManyRequestsException) return 429;
        if (e instanceof InternalServerErrorException) return 500;
        if (e instanceof BadGatewayException) return 502;
        if (e instanceof ServiceUnavailableException) return 503;
        return -1;
    }

    @FunctionalInterface
    private interface SpotifyCall<T> {
        T execute() throws IOException, SpotifyWebApiException, ParseException;
    }
}
