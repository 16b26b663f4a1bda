package com.yearlylikes.spotify;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.yearlylikes.paging.Page;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import se.michaelthelin.spotify.SpotifyApi;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SpotifyWebApiGatewayTest {

    private HttpServer server;
    private SpotifyWebApiGateway gateway;
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final Map<String, String> lastPayload = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/me", ex -> {
            record(ex);
            String path = ex.getRequestURI().getPath();
            if (path.equals("/v1/me/tracks") && "GET".equals(ex.getRequestMethod())) {
                Json.respond(ex, 200, """
                        {
                          "href": "http://127.0.0.1/v1/me/tracks",
                          "limit": 50, "offset": 0, "total": 2, "next": null, "previous": null,
                          "items": [
                            {
                              "added_at": "2023-06-15T12:00:00Z",
                              "track": {
                                "id": "t1", "name": "First", "type": "track", "uri": "spotify:track:t1",
                                "artists": [ { "id": "a1", "name": "Alpha", "type": "artist" },
                                             { "id": "a2", "name": "Beta", "type": "artist" } ]
                              }
                            },
                            {
                              "added_at": "2021-02-01T08:30:00Z",
                              "track": { "id": "t2", "name": "Second", "type": "track", "artists": [] }
                            }
                          ]
                        }
                        """);
            } else if (path.equals("/v1/me/tracks")) {
                Json.respond(ex, 200, "");
            } else {
                Json.respond(ex, 200, "{\"id\":\"me\",\"display_name\":\"Test User\",\"type\":\"user\"}");
            }
        });
        server.createContext("/v1/users/me/playlists", ex -> {
            record(ex);
            if ("POST".equals(ex.getRequestMethod())) {
                Json.respond(ex, 201, """
                        {"id":"new1","name":"Liked Songs (2023)","type":"playlist","owner":{"id":"me","type":"user"}}
                        """);
                return;
            }
            Json.respond(ex, 200, """
                    {
                      "limit": 50, "offset": 0, "total": 2,
                      "items": [
                        {"id":"p1","name":"Liked Songs (2023)","type":"playlist","owner":{"id":"me","type":"user"}},
                        {"id":"p2","name":"Followed","type":"playlist","owner":{"id":"other","type":"user"}}
                      ]
                    }
                    """);
        });
        server.createContext("/v1/playlists/p1/tracks", ex -> {
            record(ex);
            if ("GET".equals(ex.getRequestMethod())) {
                Json.respond(ex, 200, """
                        {
                          "limit": 100, "offset": 0, "total": 3,
                          "items": [
                            { "is_local": false, "track": { "id": "x", "name": "X", "type": "track" } },
                            { "is_local": false, "track": { "id": "e1", "name": "Show", "type": "episode" } },
                            { "is_local": true, "track": { "id": null, "name": "Local", "type": "track" } }
                          ]
                        }
                        """);
                return;
            }
            Json.respond(ex, 201, "{\"snapshot_id\":\"snap\"}");
        });
        server.createContext("/v1/playlists/missing/tracks", ex -> {
            record(ex);
            Json.respond(ex, 404, "{\"error\":{\"status\":404,\"message\":\"Not found.\"}}");
        });
        server.createContext("/v1/playlists/p1/images", ex -> {
            record(ex);
            ex.sendResponseHeaders(202, -1);
            ex.close();
        });
        server.start();

        SpotifyApi api = new SpotifyApi.Builder()
                .setScheme("http")
                .setHost("127.0.0.1")
                .setPort(server.getAddress().getPort())
                .setAccessToken("test-token")
                .build();
        gateway = new SpotifyWebApiGateway(api);
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void currentUser() throws Exception {
        SpotifyUser user = gateway.currentUser();

        assertEquals("me", user.id());
        assertEquals("Test User", user.displayName());
    }

    @Test
    void listLikedTracksMapsTracksAndPaging() throws Exception {
        Page<LikedTrack> page = gateway.listLikedTracks(0, 50);

        assertEquals(2, page.total());
        assertEquals(2, page.size());
        LikedTrack first = page.items().get(0);
        assertEquals("t1", first.id());
        assertEquals(List.of("Alpha", "Beta"), first.artists());
        assertEquals(2023, OffsetDateTime.parse(first.addedAt()).getYear());
        assertEquals(List.of(), page.items().get(1).artists());
        assertTrue(requests.get(0).contains("limit=50"));
    }

    @Test
    void listUserPlaylistsKeepsOwner() throws Exception {
        Page<PlaylistRef> page = gateway.listUserPlaylists("me", 0, 50);

        assertEquals(List.of(new PlaylistRef("p1", "Liked Songs (2023)", "me"),
                new PlaylistRef("p2", "Followed", "other")), page.items());
    }

    @Test
    void createPlaylistSendsSettings() throws Exception {
        PlaylistRef created = gateway.createPlaylist("me", "Liked Songs (2023)", "All songs I liked that were added in 2023.", false, false);

        assertEquals("new1", created.id());
        assertEquals("me", created.ownerId());
        String body = lastPayload.get("POST /v1/users/me/playlists");
        assertTrue(body.contains("2023"), body);
    }

    @Test
    void episodesAndLocalFilesHaveNoTrackId() throws Exception {
        Page<PlaylistItem> page = gateway.listPlaylistTracks("p1", 0, 100);

        assertEquals(3, page.size());
        assertEquals("x", page.items().get(0).trackId());
        assertFalse(page.items().get(1).hasTrackId());
        assertFalse(page.items().get(2).hasTrackId());
    }

    @Test
    void addAndRemoveUseTrackUris() throws Exception {
        gateway.addToPlaylist("p1", List.of("a", "b"));
        gateway.removeFromPlaylist("p1", List.of("x"));

        String added = lastPayload.get("POST /v1/playlists/p1/tracks");
        assertTrue(added.contains("spotify:track:a") && added.contains("spotify:track:b"), added);
        String removed = lastPayload.get("DELETE /v1/playlists/p1/tracks");
        assertTrue(removed.contains("spotify:track:x"), removed);
    }

    @Test
    void removeFromLibrarySendsIds() throws Exception {
        gateway.removeFromLibrary(List.of("t1", "t2"));

        String payload = lastPayload.get("DELETE /v1/me/tracks");
        assertTrue(payload.contains("t1") && payload.contains("t2"), payload);
    }

    @Test
    void emptyBatchesMakeNoCalls() throws Exception {
        gateway.addToPlaylist("p1", List.of());
        gateway.removeFromLibrary(List.of());

        assertTrue(requests.isEmpty());
    }

    @Test
    void notFoundCarriesStatus() {
        SpotifyClientException error = assertThrows(SpotifyClientException.class,
                () -> gateway.listPlaylistTracks("missing", 0, 100));
        assertEquals(404, error.getStatusCode());
    }

    @Test
    void oversizedBatchesAreRejectedLocally() {
        List<String> ids = Collections.nCopies(101, "t");
        assertThrows(IllegalArgumentException.class, () -> gateway.addToPlaylist("p1", ids));
        assertThrows(IllegalArgumentException.class, () -> gateway.removeFromLibrary(ids.subList(0, 51)));
        assertTrue(requests.isEmpty());
    }

    @Test
    void uploadsCover() throws Exception {
        gateway.setPlaylistImage("p1", new byte[]{(byte) 0xFF, (byte) 0xD8, 1, 2, 3});

        assertEquals(List.of("PUT /v1/playlists/p1/images?"), requests);
        assertFalse(lastPayload.get("PUT /v1/playlists/p1/images").isBlank());
    }

    @Test
    void emptyCoverIsRejected() {
        assertThrows(SpotifyClientException.class, () -> gateway.setPlaylistImage("p1", new byte[0]));
    }

    @Test
    void oversizedCoverIsRejectedLocally() {
        byte[] jpeg = new byte[200 * 1024];

        assertThrows(SpotifyClientException.class, () -> gateway.setPlaylistImage("p1", jpeg));
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("a request the server never answers fails once the request timeout passes")
    void stalledRequestTimesOut() throws Exception {
        // accepts connections into the backlog but never reads or answers
        try (ServerSocket silent = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            SpotifyApi api = new SpotifyApi.Builder()
                    .setScheme("http")
                    .setHost("127.0.0.1")
                    .setPort(silent.getLocalPort())
                    .setAccessToken("test-token")
                    .setHttpManager(SpotifyWebApiGateway.httpManager(Duration.ofMillis(500)))
                    .build();
            SpotifyWebApiGateway stalled = new SpotifyWebApiGateway(api);

            SpotifyClientException error = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> assertThrows(SpotifyClientException.class, stalled::currentUser));
            assertEquals(-1, error.getStatusCode());
        }
    }

    @Test
    void httpManagerRejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> SpotifyWebApiGateway.httpManager(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> SpotifyWebApiGateway.httpManager(null));
    }

    @Test
    void trackUris() {
        assertEquals("spotify:track:abc", SpotifyWebApiGateway.toTrackUri("abc"));
        assertEquals("spotify:track:abc", SpotifyWebApiGateway.toTrackUri("spotify:track:abc"));
    }

    private void record(HttpExchange ex) throws IOException {
        String rawQuery = ex.getRequestURI().getRawQuery();
        String query = rawQuery == null ? "" : URLDecoder.decode(rawQuery, StandardCharsets.UTF_8);
        String body = new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        String key = ex.getRequestMethod() + " " + ex.getRequestURI().getPath();
        requests.add(key + "?" + query);
        lastPayload.put(key, query + "\n" + body);
    }

    private static final class Json {
        private static void respond(HttpExchange ex, int code, String body) throws IOException {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
            ex.sendResponseHeaders(code, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(bytes);
            }
        }
    }
}
