package com.playlistmigrator.progress;

/**
 * Receives progress updates on the consumer task, in publication order.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(ProgressUpdate update);

    static ProgressListener ignoring() {
        return update -> { };
    }
}
