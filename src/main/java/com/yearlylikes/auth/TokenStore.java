package com.yearlylikes.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Properties;

/**
 * Keeps the Spotify refresh token between runs in a properties file.
 * Failures to read or write are logged; the caller then falls back to the browser login.
 */
public class TokenStore {

    private static final Logger log = LoggerFactory.getLogger(TokenStore.class);
    private static final String ACCESS_TOKEN = "access_token";
    private static final String REFRESH_TOKEN = "refresh_token";

    private final Path file;

    public TokenStore(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    public Optional<String> loadRefreshToken() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        Properties p = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            p.load(in);
        } catch (IOException e) {
            log.warn("Could not read stored tokens from {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        String refreshToken = trimOrNull(p.getProperty(REFRESH_TOKEN));
        if (refreshToken == null || refreshToken.isEmpty()) {
            return Optional.empty();
        }
        log.debug("Tokens loaded from {}", file);
        return Optional.of(refreshToken);
    }

    public void save(String accessToken, String refreshToken) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Properties p = new Properties();
            if (accessToken != null) p.setProperty(ACCESS_TOKEN, accessToken);
            if (refreshToken != null) p.setProperty(REFRESH_TOKEN, refreshToken);
            try (OutputStream out = Files.newOutputStream(file)) {
                p.store(out, "Spotify OAuth tokens");
            }
            restrictToOwner(file);
            log.debug("Tokens saved to {}", file);
        } catch (IOException e) {
            log.warn("Could not save tokens to {}: {}", file, e.getMessage());
        }
    }

    /** Deletes the stored tokens; returns true if a file was removed. */
    public boolean clear() {
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) {
                log.info("Stored tokens deleted: {}", file);
            }
            return deleted;
        } catch (IOException e) {
            log.warn("Could not delete token file {}: {}", file, e.getMessage());
            return false;
        }
    }

    private static void restrictToOwner(Path path) {
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException | IOException e) {
            log.debug("Could not restrict permissions of {}: {}", path, e.getMessage());
        }
    }

    private static String trimOrNull(String s) {
        return (s == null) ? null : s.trim();
    }
}
