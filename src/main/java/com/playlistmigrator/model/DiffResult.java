package com.playlistmigrator.model;

import java.util.List;

/**
 * The comparison of two playlists, possibly on different services.
 *
 * @param source             The exported source playlist.
 * @param destination        The exported destination playlist.
 * @param matchedCount       Source tracks found in the destination, counted once per source track.
 * @param missingInDestination Source tracks absent from the destination, in source order.
 * @param extraInDestination Destination tracks absent from the source, in destination order.
 */
public record DiffResult(
    PlaylistExport source,
    PlaylistExport destination,
    int matchedCount,
    List<Track> missingInDestination,
    List<Track> extraInDestination
) {
    public DiffResult {
        missingInDestination = List.copyOf(missingInDestination);
        extraInDestination = List.copyOf(extraInDestination);
    }

    public boolean isInSync() {
        return missingInDestination.isEmpty() && extraInDestination.isEmpty();
    }
}
