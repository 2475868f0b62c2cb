package com.playlistmigrator.auth;

import com.google.api.client.http.GenericUrl;
import com.playlistmigrator.error.ErrorKind;
import com.playlistmigrator.error.MigrationException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handles the provider's redirect to the local listener. Only the first request is processed; it yields exactly one
 * {@link OAuthResult}, delivered after the browser has been answered.
 */
class CallbackHandler implements HttpHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(CallbackHandler.class);

    static final String SUCCESS_PAGE = "<html><body><h1>Authorization successful!</h1>"
            + "<p>You can close this window and return to the terminal.</p></body></html>";

    private final String expectedState;
    private final TokenExchanger exchanger;
    private final AtomicBoolean handled = new AtomicBoolean(false);
    private final CompletableFuture<OAuthResult> result = new CompletableFuture<>();

    CallbackHandler(String expectedState, TokenExchanger exchanger) {
        this.expectedState = expectedState;
        this.exchanger = exchanger;
    }

    CompletableFuture<OAuthResult> result() {
        return result;
    }

    /**
     * Closes the gate without producing a result, so requests arriving after a timeout are rejected.
     */
    void retire() {
        handled.set(true);
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            if (!handled.compareAndSet(false, true)) {
                respond(exchange, 400, "text/plain", "Callback already processed");
                return;
            }
            GenericUrl url = new GenericUrl("http://localhost" + exchange.getRequestURI());
            Outcome outcome = process(
                    param(url, "state"), param(url, "code"), param(url, "error"), param(url, "error_description"));
            try {
                respond(exchange, outcome.status, outcome.contentType, outcome.body);
            } finally {
                deliver(outcome.result);
            }
        } finally {
            exchange.close();
        }
    }

    private Outcome process(String state, String code, String error, String errorDescription) {
        if (!expectedState.equals(state)) {
            LOGGER.warn("Rejected OAuth callback with an invalid state parameter");
            return Outcome.failure(400, "Invalid state parameter",
                    new MigrationException(ErrorKind.CSRF_STATE_MISMATCH, "callback state does not match"));
        }
        if (code == null || code.isEmpty()) {
            String reason = error == null ? "no authorization code" : error;
            if (errorDescription != null) {
                reason = reason + " (" + errorDescription + ")";
            }
            LOGGER.warn("Authorization was not granted: {}", reason);
            return Outcome.failure(400, "Authorization failed: " + reason,
                    new MigrationException(ErrorKind.AUTHORIZATION_DENIED, reason));
        }

        OAuthToken token;
        try {
            token = exchanger.exchange(code);
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Token exchange failed: {}", e.getMessage(), e);
            return Outcome.failure(500, "Failed to exchange code for token",
                    new MigrationException(ErrorKind.TOKEN_EXCHANGE_FAILED, e.getMessage(), e));
        }
        if (token == null || !token.hasAccessToken()) {
            return Outcome.failure(500, "No access token received",
                    new MigrationException(ErrorKind.NO_TOKEN_RECEIVED, "token endpoint returned no access token"));
        }
        LOGGER.info("Authorization code exchanged for an access token");
        return new Outcome(200, "text/html; charset=utf-8", SUCCESS_PAGE, OAuthResult.success(token));
    }

    private void deliver(OAuthResult outcome) {
        if (!result.complete(outcome)) {
            LOGGER.warn("OAuth result already delivered, dropping {}", outcome);
        }
    }

    private static String param(GenericUrl url, String name) {
        Object value = url.getFirst(name);
        return value == null ? null : value.toString();
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static final class Outcome {
        private final int status;
        private final String contentType;
        private final String body;
        private final OAuthResult result;

        private Outcome(int status, String contentType, String body, OAuthResult result) {
            this.status = status;
            this.contentType = contentType;
            this.body = body;
            this.result = result;
        }

        static Outcome failure(int status, String body, MigrationException failure) {
            return new Outcome(status, "text/plain; charset=utf-8", body, OAuthResult.failure(failure));
        }
    }
}
