package com.playlistmigrator.error;

/**
 * Classification of every failure the migrator reports.
 */
public enum ErrorKind {
    // Authentication
    NOT_AUTHENTICATED("not authenticated"),
    TOKEN_EXPIRED("access token expired"),
    REFRESH_FAILED("token refresh failed"),
    CSRF_STATE_MISMATCH("invalid state parameter"),
    AUTHORIZATION_DENIED("authorization failed"),
    TOKEN_EXCHANGE_FAILED("token exchange failed"),
    NO_TOKEN_RECEIVED("no token received"),
    LISTENER_STARTUP_FAILED("callback listener failed to start"),
    TIMEOUT("operation timed out"),

    // API and service
    API_REQUEST_FAILED("API request failed"),
    SERVICE_UNAVAILABLE("service unavailable"),
    PLAYLIST_NOT_FOUND("playlist not found"),
    TRACK_NOT_FOUND("track not found"),
    EMPTY_RESULT_SET("no results"),
    CANCELLED("operation cancelled"),

    // Input validation
    INVALID_ARGUMENT("invalid argument"),
    MISSING_ARGUMENT("missing required argument");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
