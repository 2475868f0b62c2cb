package com.playlistmigrator.progress;

/**
 * An advisory notification about a running operation. Consumed for display only.
 *
 * @param phase   The phase the operation is in.
 * @param step    The current step within the phase, starting at 1 ({@code 0} announces the phase).
 * @param total   The number of steps in the phase.
 * @param message A human-readable description.
 */
public record ProgressUpdate(
    Phase phase,
    int step,
    int total,
    String message
) {
}
