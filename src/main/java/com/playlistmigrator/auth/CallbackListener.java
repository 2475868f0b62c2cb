package com.playlistmigrator.auth;

import com.playlistmigrator.error.ErrorKind;
import com.playlistmigrator.error.MigrationException;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The local HTTP listener for one authorization attempt. Binding happens on the listener's own thread; callers block
 * in {@link #awaitStarted(Duration)} until it is bound or has failed.
 */
final class CallbackListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(CallbackListener.class);

    private final InetSocketAddress address;
    private final String path;
    private final HttpHandler handler;
    private final ExecutorService executor;
    private final CompletableFuture<InetSocketAddress> started = new CompletableFuture<>();

    private HttpServer server;
    private boolean stopped;

    CallbackListener(String host, int port, String path, HttpHandler handler) {
        this.address = new InetSocketAddress(host, port);
        this.path = path;
        this.handler = handler;
        this.executor = Executors.newSingleThreadExecutor(task -> {
            Thread thread = new Thread(task, "oauth-callback-" + port);
            thread.setDaemon(true);
            return thread;
        });
    }

    void start() {
        executor.execute(this::bind);
    }

    private synchronized void bind() {
        if (stopped) {
            return;
        }
        try {
            HttpServer created = HttpServer.create(address, 0);
            created.createContext(path, handler);
            created.setExecutor(executor);
            created.start();
            server = created;
            LOGGER.info("Listening for the OAuth callback on http://{}:{}{}",
                    address.getHostString(), created.getAddress().getPort(), path);
            started.complete(created.getAddress());
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Failed to start the OAuth callback listener on {}: {}", address, e.getMessage());
            started.completeExceptionally(e);
        }
    }

    /**
     * Blocks until the listener is bound.
     * @throws MigrationException with LISTENER_STARTUP_FAILED if binding failed or did not finish in time, or
     *                            CANCELLED if interrupted.
     */
    void awaitStarted(Duration wait) throws MigrationException {
        try {
            started.get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new MigrationException(ErrorKind.LISTENER_STARTUP_FAILED, "cannot listen on " + describe(), e.getCause());
        } catch (TimeoutException e) {
            throw new MigrationException(ErrorKind.LISTENER_STARTUP_FAILED,
                    "listener on " + describe() + " not ready after " + wait.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MigrationException(ErrorKind.CANCELLED, "interrupted while starting the callback listener", e);
        }
    }

    private String describe() {
        return address.getHostString() + ":" + address.getPort();
    }

    void stop(Duration grace) {
        synchronized (this) {
            stopped = true;
            if (server != null) {
                try {
                    server.stop((int) Math.min(Integer.MAX_VALUE, grace.toSeconds()));
                    LOGGER.debug("OAuth callback listener stopped");
                } catch (RuntimeException e) {
                    LOGGER.warn("Failed to stop the OAuth callback listener: {}", e.getMessage(), e);
                }
                server = null;
            }
        }
        executor.shutdown();
    }
}
