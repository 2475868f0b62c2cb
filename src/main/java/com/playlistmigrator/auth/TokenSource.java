package com.playlistmigrator.auth;

import java.io.IOException;

/**
 * Supplies a currently valid token, refreshing it if needed.
 */
@FunctionalInterface
public interface TokenSource {

    OAuthToken token() throws IOException;
}
