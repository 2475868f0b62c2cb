package com.playlistmigrator.auth;

import com.google.api.client.auth.oauth2.AuthorizationCodeTokenRequest;
import com.google.api.client.auth.oauth2.ClientParametersAuthentication;
import com.google.api.client.auth.oauth2.TokenResponse;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;

import java.io.IOException;
import java.time.Clock;

/**
 * Performs the authorization-code exchange with google-oauth-client, sending client ID and secret as form parameters.
 * Works against any standard OAuth2 token endpoint, not only Google's.
 */
public class GoogleTokenExchanger implements TokenExchanger {

    private final HttpTransport transport;
    private final JsonFactory jsonFactory;
    private final OAuthSettings settings;
    private final Clock clock;

    public GoogleTokenExchanger(HttpTransport transport, JsonFactory jsonFactory, OAuthSettings settings) {
        this(transport, jsonFactory, settings, Clock.systemUTC());
    }

    GoogleTokenExchanger(HttpTransport transport, JsonFactory jsonFactory, OAuthSettings settings, Clock clock) {
        this.transport = transport;
        this.jsonFactory = jsonFactory;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public OAuthToken exchange(String authorizationCode) throws IOException {
        TokenResponse response = new AuthorizationCodeTokenRequest(
                transport, jsonFactory, new GenericUrl(settings.tokenUrl()), authorizationCode)
                .setRedirectUri(settings.redirectUri())
                .setClientAuthentication(new ClientParametersAuthentication(settings.clientId(), settings.clientSecret()))
                .execute();
        return OAuthToken.from(response, clock);
    }
}
