package com.playlistmigrator.auth;

import com.google.api.client.auth.oauth2.TokenResponse;

import java.time.Clock;
import java.time.Instant;

/**
 * An access/refresh token pair obtained from an OAuth2 token endpoint.
 *
 * @param accessToken  The access token sent with API requests.
 * @param refreshToken The refresh token, or {@code null} if the provider issued none.
 * @param tokenType    The token type, usually "Bearer".
 * @param expiresAt    When the access token expires, or {@code null} if unknown.
 */
public record OAuthToken(
    String accessToken,
    String refreshToken,
    String tokenType,
    Instant expiresAt
) {
    private static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static OAuthToken from(TokenResponse response, Clock clock) {
        Instant expiresAt = null;
        if (response.getExpiresInSeconds() != null) {
            expiresAt = clock.instant().plusSeconds(response.getExpiresInSeconds());
        }
        return new OAuthToken(response.getAccessToken(), response.getRefreshToken(), response.getTokenType(), expiresAt);
    }

    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isEmpty();
    }

    /**
     * @return The value for the HTTP {@code Authorization} header.
     */
    public String authorizationHeader() {
        String type = tokenType == null || tokenType.isEmpty() ? DEFAULT_TOKEN_TYPE : tokenType;
        if ("bearer".equalsIgnoreCase(type)) {
            type = DEFAULT_TOKEN_TYPE;
        }
        return type + " " + accessToken;
    }

    @Override
    public String toString() {
        // Keep secrets out of logs
        return "OAuthToken[tokenType=" + tokenType + ", expiresAt=" + expiresAt
                + ", hasRefreshToken=" + (refreshToken != null) + "]";
    }
}
