package com.playlistmigrator.model;

import java.util.List;
import java.util.Objects;

/**
 * A playlist together with its complete, ordered track list, fetched in one operation.
 *
 * @param playlist The playlist metadata.
 * @param tracks   The tracks in playlist order.
 */
public record PlaylistExport(
    Playlist playlist,
    List<Track> tracks
) {
    public PlaylistExport {
        Objects.requireNonNull(playlist, "playlist");
        tracks = tracks == null ? List.of() : List.copyOf(tracks);
    }

    public int size() {
        return tracks.size();
    }

    /**
     * Returns a copy holding at most {@code maxTracks} tracks from the start of the list.
     * @param maxTracks The maximum number of tracks to keep.
     * @return This export if it is already small enough, otherwise a truncated copy.
     */
    public PlaylistExport limit(int maxTracks) {
        if (maxTracks < 0) {
            throw new IllegalArgumentException("maxTracks must not be negative: " + maxTracks);
        }
        if (tracks.size() <= maxTracks) {
            return this;
        }
        return new PlaylistExport(playlist, tracks.subList(0, maxTracks));
    }
}
