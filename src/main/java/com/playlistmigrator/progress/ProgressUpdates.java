package com.playlistmigrator.progress;

import com.playlistmigrator.model.Playlist;
import com.playlistmigrator.model.PlaylistExport;
import com.playlistmigrator.model.Track;

/**
 * Factory methods for the updates the transfer engine publishes.
 */
public final class ProgressUpdates {

    private ProgressUpdates() {
    }

    public static ProgressUpdate resolvingSource(String idOrName, String serviceName) {
        return new ProgressUpdate(Phase.RESOLVE_SOURCE, 1, 1,
                String.format("Resolving source playlist '%s' on %s...", idOrName, serviceName));
    }

    public static ProgressUpdate searchingByName(String name) {
        return new ProgressUpdate(Phase.RESOLVE_SOURCE, 1, 1,
                String.format("Source ID not found, searching playlists named '%s'...", name));
    }

    public static ProgressUpdate fetchingSource(int step, int total, String serviceName) {
        return new ProgressUpdate(Phase.FETCH_SOURCE, step, total,
                String.format("Fetching source playlist (%s)...", serviceName));
    }

    public static ProgressUpdate foundPlaylist(PlaylistExport export) {
        return new ProgressUpdate(Phase.FETCH_SOURCE, 1, 1,
                String.format("Found playlist: %s (%d tracks)", export.playlist().name(), export.size()));
    }

    public static ProgressUpdate fetchingDestination(int step, int total, String serviceName) {
        return new ProgressUpdate(Phase.FETCH_DESTINATION, step, total,
                String.format("Fetching destination playlist (%s)...", serviceName));
    }

    public static ProgressUpdate buildingLookups(int step, int total) {
        return new ProgressUpdate(Phase.COMPARE, step, total, "Building track comparison maps...");
    }

    public static ProgressUpdate comparingTracks(int step, int total) {
        return new ProgressUpdate(Phase.COMPARE, step, total, "Comparing tracks...");
    }

    public static ProgressUpdate searchingTracks(int total, String serviceName) {
        return new ProgressUpdate(Phase.SEARCH_TRACKS, 0, total,
                String.format("Searching for tracks on %s...", serviceName));
    }

    public static ProgressUpdate searchingTrack(int step, int total, Track track) {
        return new ProgressUpdate(Phase.SEARCH_TRACKS, step, total,
                String.format("[%d/%d] %s - %s", step, total, track.artist(), track.title()));
    }

    public static ProgressUpdate creatingPlaylist(String serviceName) {
        return new ProgressUpdate(Phase.CREATE_PLAYLIST, 1, 2,
                String.format("Creating playlist on %s...", serviceName));
    }

    public static ProgressUpdate playlistCreated(Playlist playlist) {
        return new ProgressUpdate(Phase.CREATE_PLAYLIST, 2, 2,
                String.format("Playlist created: %s (ID: %s)", playlist.name(), playlist.id()));
    }

    public static ProgressUpdate transferComplete(int matched, int total) {
        return new ProgressUpdate(Phase.DONE, 1, 1,
                String.format("Transfer complete: matched %d/%d tracks", matched, total));
    }

    public static ProgressUpdate diffComplete(int matched, int missing, int extra) {
        return new ProgressUpdate(Phase.DONE, 1, 1,
                String.format("Comparison complete: %d matched, %d missing, %d extra", matched, missing, extra));
    }
}
