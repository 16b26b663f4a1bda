package com.yearlylikes.auth;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.yearlylikes.spotify.SpotifyWebApiGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.michaelthelin.spotify.SpotifyApi;
import se.michaelthelin.spotify.model_objects.credentials.AuthorizationCodeCredentials;
import se.michaelthelin.spotify.requests.authorization.authorization_code.AuthorizationCodeUriRequest;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Authorization code flow for a command line run.
 * <p>
 * A stored refresh token is tried first. Otherwise the user opens {@link #authorizationUrl()} in a
 * browser and a one-shot local HTTP server receives the redirect, checks the state token and
 * exchanges the code.
 */
public class SpotifyAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(SpotifyAuthenticator.class);
    static final String[] SCOPES = {
            "user-library-read",
            "user-library-modify",
            "playlist-read-private",
            "playlist-modify-public",
            "playlist-modify-private",
            "ugc-image-upload"
    };
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final String clientId;
    private final String clientSecret;
    private final URI redirectUri;
    private final TokenStore tokenStore;
    private final Duration requestTimeout;
    private final String state;

    public SpotifyAuthenticator(String clientId, String clientSecret, URI redirectUri, TokenStore tokenStore) {
        this(clientId, clientSecret, redirectUri, tokenStore, DEFAULT_REQUEST_TIMEOUT);
    }

    /**
     * @param requestTimeout bound for each Spotify request made by this authenticator and by the clients it returns
     */
    public SpotifyAuthenticator(String clientId, String clientSecret, URI redirectUri, TokenStore tokenStore,
                                Duration requestTimeout) {
        if (clientId == null || clientId.isBlank() || clientSecret == null || clientSecret.isBlank()) {
            throw new IllegalArgumentException("Spotify client id and secret are required");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        this.clientId = clientId.trim();
        this.clientSecret = clientSecret.trim();
        this.redirectUri = redirectUri;
        this.tokenStore = tokenStore;
        this.requestTimeout = requestTimeout;

        byte[] stateBytes = new byte[24];
        SECURE_RANDOM.nextBytes(stateBytes);
        this.state = Base64.getUrlEncoder().withoutPadding().encodeToString(stateBytes);
    }

    /**
     * URL the user must visit to grant access.
     */
    public String authorizationUrl() {
        AuthorizationCodeUriRequest uriRequest = newApi().authorizationCodeUri()
                .scope(String.join(" ", SCOPES))
                .state(state)
                .build();
        return uriRequest.execute().toString();
    }

    String getState() {
        return state;
    }

    Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * Refreshes the stored token, if any. Returns empty when there is none or Spotify rejects it.
     */
    public Optional<SpotifyApi> resumeFromStoredToken() {
        if (tokenStore == null) {
            return Optional.empty();
        }
        Optional<String> refreshToken = tokenStore.loadRefreshToken();
        if (refreshToken.isEmpty()) {
            log.info("No stored tokens found, starting interactive login...");
            return Optional.empty();
        }
        SpotifyApi api = newApi();
        api.setRefreshToken(refreshToken.get());
        try {
            AuthorizationCodeCredentials credentials = api.authorizationCodeRefresh().build().execute();
            api.setAccessToken(credentials.getAccessToken());
            String newRefreshToken = credentials.getRefreshToken();
            if (newRefreshToken != null && !newRefreshToken.isBlank()) {
                api.setRefreshToken(newRefreshToken);
            }
            tokenStore.save(api.getAccessToken(), api.getRefreshToken());
            log.info("Access token renewed from stored refresh token.");
            return Optional.of(api);
        } catch (Exception e) {
            log.warn("Stored tokens are no longer valid, starting interactive login: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Waits for the browser redirect and returns an authorized client.
     *
     * @throws AuthenticationException if the user denies access, the state does not match,
     *                                 the code exchange fails or nothing arrives within {@code timeout}
     */
    public SpotifyApi authorize(Duration timeout) throws AuthenticationException {
        CompletableFuture<SpotifyApi> result = new CompletableFuture<>();
        HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(callbackPort()), 0);
        } catch (IOException e) {
            throw new AuthenticationException("Could not start callback server on port " + callbackPort() + ": " + e.getMessage(), e);
        }
        ExecutorService executor = Executors.newSingleThreadExecutor();
        server.createContext(callbackPath(), exchange -> handleCallback(exchange, result));
        server.setExecutor(executor);
        server.start();
        log.info("Waiting for callback on: {}", redirectUri);

        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new AuthenticationException("No Spotify login within " + timeout.toSeconds() + " seconds");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AuthenticationException authError) {
                throw authError;
            }
            throw new AuthenticationException("Spotify login failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationException("Interrupted while waiting for Spotify login", e);
        } finally {
            server.stop(1);
            executor.shutdownNow();
        }
    }

    private void handleCallback(HttpExchange exchange, CompletableFuture<SpotifyApi> result) throws IOException {
        Map<String, String> params = parseQuery(exchange.getRequestURI().getRawQuery());

        String error = params.get("error");
        if (error != null) {
            respond(exchange, 403, "<h2>Login cancelled</h2><p>Spotify reported: " + escapeHtml(error) + "</p>");
            result.completeExceptionally(new AuthenticationException("Spotify authorization denied: " + error));
            return;
        }
        if (!state.equals(params.get("state"))) {
            respond(exchange, 403, "<h2>Invalid state</h2><p>Please start the login again.</p>");
            result.completeExceptionally(new AuthenticationException("OAuth state mismatch in callback"));
            return;
        }
        String code = params.get("code");
        if (code == null || code.isBlank()) {
            respond(exchange, 400, "<h2>Missing code</h2><p>No 'code' in the URL. Please try again.</p>");
            return;
        }

        try {
            SpotifyApi api = newApi();
            AuthorizationCodeCredentials credentials = api.authorizationCode(code).build().execute();
            api.setAccessToken(credentials.getAccessToken());
            api.setRefreshToken(credentials.getRefreshToken());
            if (tokenStore != null) {
                tokenStore.save(credentials.getAccessToken(), credentials.getRefreshToken());
            }
            respond(exchange, 200, "<h2>Login completed!</h2><p>You can close this window now.</p>");
            result.complete(api);
        } catch (Exception e) {
            log.error("Spotify token exchange failed: {}", e.getMessage(), e);
            respond(exchange, 500, "<h2>Login failed</h2><p>Could not get a token from Spotify.</p>");
            result.completeExceptionally(new AuthenticationException("Could not get token: " + e.getMessage(), e));
        }
    }

    private SpotifyApi newApi() {
        return new SpotifyApi.Builder()
                .setClientId(clientId)
                .setClientSecret(clientSecret)
                .setRedirectUri(redirectUri)
                .setHttpManager(SpotifyWebApiGateway.httpManager(requestTimeout))
                .build();
    }

    int callbackPort() {
        int port = redirectUri.getPort();
        if (port > 0) {
            return port;
        }
        return "https".equalsIgnoreCase(redirectUri.getScheme()) ? 443 : 80;
    }

    String callbackPath() {
        String path = redirectUri.getPath();
        return (path == null || path.isBlank()) ? "/" : path;
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isBlank()) {
            return params;
        }
        for (String part : rawQuery.split("&")) {
            int idx = part.indexOf('=');
            if (idx <= 0) continue;
            String key = URLDecoder.decode(part.substring(0, idx), StandardCharsets.UTF_8);
            String value = URLDecoder.decode(part.substring(idx + 1), StandardCharsets.UTF_8);
            params.putIfAbsent(key, value);
        }
        return params;
    }

    private static void respond(HttpExchange exchange, int status, String content) throws IOException {
        String html = "<html><body style=\"font-family:sans-serif\">" + content + "</body></html>";
        byte[] body = html.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private static String escapeHtml(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }
}
