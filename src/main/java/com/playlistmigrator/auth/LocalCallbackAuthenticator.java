package com.playlistmigrator.auth;

import com.google.api.client.auth.oauth2.AuthorizationCodeRequestUrl;
import com.playlistmigrator.error.ErrorKind;
import com.playlistmigrator.error.MigrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the OAuth2 authorization-code flow through a short-lived listener on the loopback interface.
 * <p>
 * An instance is one attempt: {@link #authorize()} may be called once. The listener is stopped on every exit path.
 */
public class LocalCallbackAuthenticator {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalCallbackAuthenticator.class);

    private static final Duration STARTUP_WAIT = Duration.ofSeconds(2);

    public enum State {
        IDLE,
        SERVER_STARTED,
        AWAITING_CALLBACK,
        COMPLETED,
        FAILED,
        TIMED_OUT
    }

    private final OAuthSettings settings;
    private final TokenExchanger exchanger;
    private final BrowserLauncher browser;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

    public LocalCallbackAuthenticator(OAuthSettings settings, TokenExchanger exchanger) {
        this(settings, exchanger, BrowserLauncher.system());
    }

    public LocalCallbackAuthenticator(OAuthSettings settings, TokenExchanger exchanger, BrowserLauncher browser) {
        this.settings = settings;
        this.exchanger = exchanger;
        this.browser = browser;
    }

    public State getState() {
        return state.get();
    }

    /**
     * Opens the consent page and waits for the provider to redirect back with a code.
     * @return The exchanged token.
     * @throws MigrationException classified as CSRF_STATE_MISMATCH, AUTHORIZATION_DENIED, TOKEN_EXCHANGE_FAILED,
     *                            NO_TOKEN_RECEIVED, LISTENER_STARTUP_FAILED, TIMEOUT or CANCELLED.
     * @throws IllegalStateException if this attempt has already been run.
     */
    public OAuthToken authorize() throws MigrationException {
        if (!state.compareAndSet(State.IDLE, State.SERVER_STARTED)) {
            throw new IllegalStateException("Authorization attempt already used (state " + state.get() + ")");
        }

        String csrfState = StateTokens.generate();
        CallbackHandler handler = new CallbackHandler(csrfState, exchanger);
        CallbackListener listener = new CallbackListener(
                settings.callbackHost(), settings.callbackPort(), settings.callbackPath(), handler);
        listener.start();
        try {
            listener.awaitStarted(STARTUP_WAIT);

            String url = authorizationUrl(csrfState);
            openBrowser(url);
            state.set(State.AWAITING_CALLBACK);

            OAuthResult outcome = awaitResult(handler);
            OAuthToken token = outcome.tokenOrThrow();
            state.set(State.COMPLETED);
            return token;
        } catch (MigrationException e) {
            if (!e.is(ErrorKind.TIMEOUT)) {
                state.set(State.FAILED);
            }
            throw e;
        } finally {
            listener.stop(settings.shutdownGrace());
        }
    }

    String authorizationUrl(String csrfState) {
        AuthorizationCodeRequestUrl url = new AuthorizationCodeRequestUrl(
                settings.authorizationUrl(), settings.clientId())
                .setRedirectUri(settings.redirectUri())
                .setScopes(settings.scopes())
                .setState(csrfState);
        url.set("access_type", "offline");
        return url.build();
    }

    private void openBrowser(String url) {
        LOGGER.info("Opening the browser for authorization. If it does not open, visit:\n{}", url);
        try {
            browser.browse(url);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Failed to open the browser: {}. Please open the URL manually.", e.getMessage());
        }
    }

    private OAuthResult awaitResult(CallbackHandler handler) throws MigrationException {
        try {
            return handler.result().get(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            handler.retire();
            state.set(State.TIMED_OUT);
            throw new MigrationException(ErrorKind.TIMEOUT,
                    "no authorization callback within " + settings.timeout().toSeconds() + "s");
        } catch (InterruptedException e) {
            handler.retire();
            Thread.currentThread().interrupt();
            throw new MigrationException(ErrorKind.CANCELLED, "interrupted while waiting for authorization", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Callback result is only ever completed normally", e.getCause());
        }
    }
}
