package com.playlistmigrator.auth;

import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestInitializer;

import java.io.IOException;

/**
 * Authorizes every google-http-client request with the current token from a {@link TokenSource}.
 */
public class TokenSourceRequestInitializer implements HttpRequestInitializer {

    private final TokenSource tokenSource;

    public TokenSourceRequestInitializer(TokenSource tokenSource) {
        this.tokenSource = tokenSource;
    }

    @Override
    public void initialize(HttpRequest request) throws IOException {
        OAuthToken token = tokenSource.token();
        if (token == null || !token.hasAccessToken()) {
            throw new IOException("no access token available");
        }
        request.getHeaders().setAuthorization(token.authorizationHeader());
    }
}
