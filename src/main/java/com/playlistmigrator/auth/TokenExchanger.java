package com.playlistmigrator.auth;

import java.io.IOException;

/**
 * Exchanges an authorization code for tokens at the provider's token endpoint.
 */
@FunctionalInterface
public interface TokenExchanger {

    OAuthToken exchange(String authorizationCode) throws IOException;
}
