package com.playlistmigrator.model;

import com.playlistmigrator.error.MigrationException;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of searching the destination catalog for one source track.
 * Exactly one of {@code matched} and {@code failure} is set.
 *
 * @param original The source track.
 * @param matched  The destination track, or {@code null} if the search failed.
 * @param failure  Why the search failed, or {@code null} if it succeeded.
 */
public record TrackMatch(
    Track original,
    Track matched,
    MigrationException failure
) {
    public TrackMatch {
        Objects.requireNonNull(original, "original");
        if ((matched == null) == (failure == null)) {
            throw new IllegalArgumentException("A track match needs either a matched track or a failure");
        }
    }

    public static TrackMatch found(Track original, Track matched) {
        return new TrackMatch(original, matched, null);
    }

    public static TrackMatch notFound(Track original, MigrationException failure) {
        return new TrackMatch(original, null, failure);
    }

    public boolean isMatched() {
        return matched != null;
    }

    public Optional<Track> matchedTrack() {
        return Optional.ofNullable(matched);
    }
}
