package com.playlistmigrator.auth;

import com.google.api.client.auth.oauth2.Credential;

import java.io.IOException;
import java.time.Instant;

/**
 * A {@link TokenSource} backed by a google-oauth-client {@link Credential}, refreshed shortly before it expires.
 */
public class CredentialTokenSource implements TokenSource {

    static final long REFRESH_WINDOW_SECONDS = 60;

    private final Credential credential;

    public CredentialTokenSource(Credential credential) {
        this.credential = credential;
    }

    @Override
    public synchronized OAuthToken token() throws IOException {
        if (needsRefresh()) {
            if (credential.getRefreshToken() == null) {
                throw new IOException("access token expired and no refresh token is available");
            }
            if (!credential.refreshToken()) {
                throw new IOException("token refresh was rejected by " + credential.getTokenServerEncodedUrl());
            }
        }
        Long expiresAtMillis = credential.getExpirationTimeMilliseconds();
        return new OAuthToken(
                credential.getAccessToken(),
                credential.getRefreshToken(),
                "Bearer",
                expiresAtMillis == null ? null : Instant.ofEpochMilli(expiresAtMillis));
    }

    private boolean needsRefresh() {
        if (credential.getAccessToken() == null) {
            return true;
        }
        Long expiresIn = credential.getExpiresInSeconds();
        return expiresIn != null && expiresIn <= REFRESH_WINDOW_SECONDS;
    }
}
