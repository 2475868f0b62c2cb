package com.playlistmigrator.auth;

import java.time.Duration;
import java.util.List;

/**
 * Client registration and local listener settings for one OAuth2 provider.
 */
public record OAuthSettings(
    String clientId,
    String clientSecret,
    String authorizationUrl,
    String tokenUrl,
    List<String> scopes,
    String callbackHost,
    int callbackPort,
    String callbackPath,
    Duration timeout,
    Duration shutdownGrace
) {
    public OAuthSettings {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        if (callbackPath == null || callbackPath.isEmpty()) {
            callbackPath = "/callback";
        } else if (!callbackPath.startsWith("/")) {
            callbackPath = "/" + callbackPath;
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (shutdownGrace == null || shutdownGrace.isNegative()) {
            shutdownGrace = Duration.ZERO;
        }
    }

    /**
     * @return The redirect URI registered with the provider; it points at the local listener.
     */
    public String redirectUri() {
        return "http://" + callbackHost + ":" + callbackPort + callbackPath;
    }

    public OAuthSettings withTimeout(Duration newTimeout) {
        return new OAuthSettings(clientId, clientSecret, authorizationUrl, tokenUrl, scopes,
                callbackHost, callbackPort, callbackPath, newTimeout, shutdownGrace);
    }

    @Override
    public String toString() {
        return "OAuthSettings[clientId=" + clientId + ", authorizationUrl=" + authorizationUrl
                + ", redirectUri=" + redirectUri() + ", scopes=" + scopes + ", timeout=" + timeout + "]";
    }
}
