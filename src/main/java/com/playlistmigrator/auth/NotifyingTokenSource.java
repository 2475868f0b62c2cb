package com.playlistmigrator.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decorates a {@link TokenSource} and reports each new access token to a listener.
 * <p>
 * The first token seen counts as new. Listener failures are logged and never reach the caller.
 */
public class NotifyingTokenSource implements TokenSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(NotifyingTokenSource.class);

    private final TokenSource delegate;
    private final TokenRefreshListener listener;
    private final AtomicReference<String> lastAccessToken = new AtomicReference<>();

    /**
     * @param delegate The underlying source.
     * @param listener Notified of new tokens; {@code null} disables notification.
     */
    public NotifyingTokenSource(TokenSource delegate, TokenRefreshListener listener) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.listener = listener;
    }

    @Override
    public OAuthToken token() throws IOException {
        OAuthToken token = delegate.token();
        if (token == null) {
            return null;
        }
        String current = token.accessToken();
        if (!Objects.equals(lastAccessToken.get(), current)) {
            notifyListener(token);
            lastAccessToken.set(current);
        }
        return token;
    }

    private void notifyListener(OAuthToken token) {
        if (listener == null) {
            return;
        }
        try {
            listener.onTokenRefreshed(token);
        } catch (RuntimeException e) {
            LOGGER.warn("Token refresh listener failed: {}", e.getMessage(), e);
        }
    }
}
