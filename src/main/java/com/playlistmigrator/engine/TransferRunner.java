package com.playlistmigrator.engine;

import com.playlistmigrator.error.MigrationException;
import com.playlistmigrator.model.DiffResult;
import com.playlistmigrator.model.PlaylistRef;
import com.playlistmigrator.model.TransferResult;
import com.playlistmigrator.progress.ProgressChannel;
import com.playlistmigrator.progress.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs engine operations with a live progress consumer.
 * <p>
 * Each invocation gets its own {@link ProgressChannel}; the listener drains it on a separate consumer task while the
 * engine runs on the calling thread. The call returns only after the consumer has seen the end of the stream.
 */
public class TransferRunner implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransferRunner.class);

    private final TransferEngine engine;
    private final int queueCapacity;
    private final ExecutorService consumers;

    public TransferRunner(TransferEngine engine, int queueCapacity) {
        this.engine = engine;
        this.queueCapacity = queueCapacity;
        this.consumers = Executors.newCachedThreadPool(new ConsumerThreadFactory());
    }

    public TransferResult run(String sourceLabel, String destLabel, String sourceIdOrName, String destName,
                              ProgressListener listener) throws MigrationException {
        return withProgress(listener,
                channel -> engine.run(sourceLabel, destLabel, sourceIdOrName, destName, channel));
    }

    public DiffResult diff(PlaylistRef source, PlaylistRef destination, ProgressListener listener)
            throws MigrationException {
        return withProgress(listener, channel -> engine.diff(source, destination, channel));
    }

    private <T> T withProgress(ProgressListener listener, EngineOperation<T> operation) throws MigrationException {
        ProgressChannel channel = new ProgressChannel(queueCapacity);
        Future<Integer> consumer = consumers.submit(() -> channel.drainTo(listener));
        try {
            return operation.execute(channel);
        } finally {
            // The engine closes the channel; closing again is a no-op and covers a failure before it got the channel.
            channel.close();
            awaitConsumer(consumer);
        }
    }

    private static void awaitConsumer(Future<Integer> consumer) {
        try {
            Integer delivered = consumer.get();
            LOGGER.debug("Progress consumer finished after {} updates", delivered);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            consumer.cancel(true);
            LOGGER.warn("Interrupted while waiting for the progress consumer to finish");
        } catch (ExecutionException e) {
            LOGGER.warn("Progress consumer failed: {}", e.getCause().getMessage(), e.getCause());
        }
    }

    @Override
    public void close() {
        consumers.shutdownNow();
    }

    @FunctionalInterface
    private interface EngineOperation<T> {
        T execute(ProgressChannel channel) throws MigrationException;
    }

    private static final class ConsumerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "progress-consumer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
