package com.playlistmigrator.auth;

/**
 * Notified when a {@link NotifyingTokenSource} sees an access token it has not seen before, typically so that the
 * caller can persist it.
 */
@FunctionalInterface
public interface TokenRefreshListener {

    void onTokenRefreshed(OAuthToken token);
}
