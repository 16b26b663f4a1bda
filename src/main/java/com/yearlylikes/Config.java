package com.yearlylikes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Application settings.
 * <p>
 * Sources, lowest to highest precedence: {@code ~/.yearly-likes/config.properties},
 * {@code .env} in the working directory, process environment.
 */
public final class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);

    static final Path HOME_DIR = Path.of(System.getProperty("user.home"), ".yearly-likes");
    static final Path DEFAULT_PROPERTIES_FILE = HOME_DIR.resolve("config.properties");
    static final Path DEFAULT_DOTENV_FILE = Path.of(".env");

    static final String SPOTIFY_CLIENT_ID = "SPOTIFY_CLIENT_ID";
    static final String SPOTIFY_CLIENT_SECRET = "SPOTIFY_CLIENT_SECRET";
    static final String SPOTIFY_REDIRECT_URI = "SPOTIFY_REDIRECT_URI";
    static final String AUTH_TIMEOUT_SECONDS = "AUTH_TIMEOUT_SECONDS";
    static final String RUN_TIMEOUT_MINUTES = "RUN_TIMEOUT_MINUTES";
    static final String REQUEST_TIMEOUT_SECONDS = "REQUEST_TIMEOUT_SECONDS";
    static final String BLOCKED_ARTISTS = "BLOCKED_ARTISTS";
    static final String TOKEN_FILE = "TOKEN_FILE";

    private static final Set<String> KNOWN_KEYS = Set.of(
            SPOTIFY_CLIENT_ID, SPOTIFY_CLIENT_SECRET, SPOTIFY_REDIRECT_URI,
            AUTH_TIMEOUT_SECONDS, RUN_TIMEOUT_MINUTES, REQUEST_TIMEOUT_SECONDS, BLOCKED_ARTISTS, TOKEN_FILE);

    private static final String DEFAULT_REDIRECT_URI = "http://127.0.0.1:3000/callback";
    private static final int DEFAULT_AUTH_TIMEOUT_SECONDS = 180;
    private static final int DEFAULT_RUN_TIMEOUT_MINUTES = 30;
    private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

    private final Map<String, String> values;

    private Config(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    /** Loads from the default locations and the process environment. */
    public static Config load() {
        return load(DEFAULT_PROPERTIES_FILE, DEFAULT_DOTENV_FILE, System.getenv());
    }

    static Config load(Path propertiesFile, Path dotEnvFile, Map<String, String> env) {
        Map<String, String> values = new HashMap<>();
        loadPropertiesIfPresent(propertiesFile, values);
        loadDotEnvIfPresent(dotEnvFile, values);
        for (String key : KNOWN_KEYS) {
            String v = env.get(key);
            if (v != null && !v.isBlank()) {
                values.put(key, v.trim());
            }
        }
        return new Config(values);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String getSpotifyClientId() {
        return values.get(SPOTIFY_CLIENT_ID);
    }

    public String getSpotifyClientSecret() {
        return values.get(SPOTIFY_CLIENT_SECRET);
    }

    public boolean hasSpotifyCredentials() {
        return notBlank(getSpotifyClientId()) && notBlank(getSpotifyClientSecret());
    }

    public URI getRedirectUri() {
        String configured = values.get(SPOTIFY_REDIRECT_URI);
        if (notBlank(configured)) {
            try {
                return URI.create(configured.trim());
            } catch (IllegalArgumentException e) {
                log.warn("Invalid {} '{}', using {}", SPOTIFY_REDIRECT_URI, configured, DEFAULT_REDIRECT_URI);
            }
        }
        return URI.create(DEFAULT_REDIRECT_URI);
    }

    public Duration getAuthTimeout() {
        return Duration.ofSeconds(positiveInt(AUTH_TIMEOUT_SECONDS, DEFAULT_AUTH_TIMEOUT_SECONDS));
    }

    public Duration getRunTimeout() {
        return Duration.ofMinutes(positiveInt(RUN_TIMEOUT_MINUTES, DEFAULT_RUN_TIMEOUT_MINUTES));
    }

    /** Bound for a single Spotify request; the run deadline is only checked between requests. */
    public Duration getRequestTimeout() {
        return Duration.ofSeconds(positiveInt(REQUEST_TIMEOUT_SECONDS, DEFAULT_REQUEST_TIMEOUT_SECONDS));
    }

    /** Comma separated artist names; blank entries are dropped. */
    public List<String> getBlockedArtists() {
        String raw = values.get(BLOCKED_ARTISTS);
        List<String> names = new ArrayList<>();
        if (raw == null) {
            return names;
        }
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                names.add(part.trim());
            }
        }
        return names;
    }

    public Path getTokenFile() {
        String configured = values.get(TOKEN_FILE);
        return notBlank(configured) ? Path.of(configured.trim()) : HOME_DIR.resolve("spotify.tokens");
    }

    public void printStatus() {
        log.info("Spotify credentials: {}", hasSpotifyCredentials() ? "configured" : "MISSING");
        log.info("Redirect URI: {}", getRedirectUri());
        log.info("Run timeout: {} min, request timeout: {} s", getRunTimeout().toMinutes(), getRequestTimeout().toSeconds());
        log.info("Token file: {}", getTokenFile());
    }

    // =========================================================================
    // Loading
    // =========================================================================

    private static void loadPropertiesIfPresent(Path file, Map<String, String> into) {
        if (file == null || !Files.exists(file)) {
            return;
        }
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Could not load config from {}: {}", file, e.getMessage());
            return;
        }
        for (String key : KNOWN_KEYS) {
            String v = props.getProperty(key);
            if (v != null && !v.isBlank()) {
                into.put(key, v.trim());
            }
        }
    }

    private static void loadDotEnvIfPresent(Path file, Map<String, String> into) {
        if (file == null || !Files.exists(file)) {
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not load .env file {}: {}", file, e.getMessage());
            return;
        }
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            if (trimmed.startsWith("export ")) {
                trimmed = trimmed.substring("export ".length()).trim();
            }
            int idx = trimmed.indexOf('=');
            if (idx <= 0) continue;
            String key = trimmed.substring(0, idx).trim();
            if (!KNOWN_KEYS.contains(key)) continue;
            String value = stripQuotes(trimmed.substring(idx + 1).trim());
            if (!value.isBlank()) {
                into.put(key, value);
            }
        }
    }

    private static String stripQuotes(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private int positiveInt(String key, int fallback) {
        String raw = values.get(key);
        if (raw == null) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            return parsed > 0 ? parsed : fallback;
        } catch (NumberFormatException e) {
            log.warn("Invalid {} '{}', using {}", key, raw, fallback);
            return fallback;
        }
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
