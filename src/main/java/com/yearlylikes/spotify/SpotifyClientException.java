package com.yearlylikes.spotify;

/**
 * A Spotify call failed, either on the wire or with an API error response.
 */
public class SpotifyClientException extends Exception {

    private final int statusCode;

    public SpotifyClientException(String message) {
        this(message, -1, null);
    }

    public SpotifyClientException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public SpotifyClientException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status reported by Spotify, or -1 when the call failed before a response arrived. */
    public int getStatusCode() {
        return statusCode;
    }
}
