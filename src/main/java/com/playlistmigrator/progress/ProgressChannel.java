package com.playlistmigrator.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded, ordered stream of progress updates from one producer (the engine) to one consumer (a presentation task).
 * <p>
 * The producer blocks when the queue is full and must close the channel once its operation is over, whatever the
 * outcome. The consumer must drain until the end of the stream so that a blocked producer is always released.
 */
public class ProgressChannel {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressChannel.class);

    /** Marks the end of the stream. Compared by identity. */
    private static final ProgressUpdate END_OF_STREAM = new ProgressUpdate(Phase.DONE, -1, -1, "<end of stream>");

    private final BlockingQueue<ProgressUpdate> queue;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean drained;

    public ProgressChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Enqueues an update, waiting for space if the consumer is behind.
     * @throws InterruptedException  if the producer is interrupted while waiting.
     * @throws IllegalStateException if the channel was already closed.
     */
    public void publish(ProgressUpdate update) throws InterruptedException {
        if (closed.get()) {
            throw new IllegalStateException("Progress channel already closed");
        }
        queue.put(update);
    }

    /**
     * Ends the stream. Safe to call more than once; only the first call has an effect.
     * Waits for queue space without reacting to interruption, restoring the interrupt flag afterwards.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        boolean interrupted = false;
        while (true) {
            try {
                queue.put(END_OF_STREAM);
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Waits for the next update.
     * @return The update, or an empty Optional once the channel is closed and every update has been taken.
     */
    public Optional<ProgressUpdate> take() throws InterruptedException {
        if (drained) {
            return Optional.empty();
        }
        ProgressUpdate update = queue.take();
        if (update == END_OF_STREAM) {
            drained = true;
            return Optional.empty();
        }
        return Optional.of(update);
    }

    /**
     * Delivers every update to the listener until the stream ends. A failing listener is logged and skipped so the
     * producer is never left blocked on a full queue.
     * @return The number of updates delivered.
     */
    public int drainTo(ProgressListener listener) throws InterruptedException {
        int delivered = 0;
        Optional<ProgressUpdate> next;
        while ((next = take()).isPresent()) {
            delivered++;
            try {
                listener.onProgress(next.get());
            } catch (RuntimeException e) {
                LOGGER.warn("Progress listener failed on update '{}': {}", next.get().message(), e.getMessage(), e);
            }
        }
        return delivered;
    }
}
