package com.playlistmigrator.model;

import java.util.List;

/**
 * Everything a migration run produced.
 *
 * @param source       The exported source playlist.
 * @param destination  The playlist created on the destination service, {@code null} if none was created.
 * @param matches      One entry per source track, in source order.
 * @param totalTracks  The number of source tracks.
 * @param successCount The number of tracks found on the destination.
 * @param failedCount  The number of tracks that could not be found.
 * @param successRate  {@code successCount / totalTracks * 100}, {@code 0.0} for an empty source.
 */
public record TransferResult(
    PlaylistExport source,
    Playlist destination,
    List<TrackMatch> matches,
    int totalTracks,
    int successCount,
    int failedCount,
    double successRate
) {
    public TransferResult {
        matches = List.copyOf(matches);
    }

    /**
     * Builds a result from the per-track matches, deriving the counts.
     */
    public static TransferResult of(PlaylistExport source, Playlist destination, List<TrackMatch> matches) {
        int total = matches.size();
        int success = (int) matches.stream().filter(TrackMatch::isMatched).count();
        return new TransferResult(source, destination, matches, total, success, total - success,
                successRate(success, total));
    }

    static double successRate(int success, int total) {
        if (total == 0) {
            return 0.0;
        }
        return (double) success / total * 100;
    }

    public TransferResult withDestination(Playlist createdPlaylist) {
        return new TransferResult(source, createdPlaylist, matches, totalTracks, successCount, failedCount, successRate);
    }

    public List<Track> matchedTracks() {
        return matches.stream()
                .filter(TrackMatch::isMatched)
                .map(TrackMatch::matched)
                .toList();
    }

    /**
     * @return The source tracks that could not be found on the destination, in source order.
     */
    public List<Track> unmatchedTracks() {
        return matches.stream()
                .filter(m -> !m.isMatched())
                .map(TrackMatch::original)
                .toList();
    }
}
