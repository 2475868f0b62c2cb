package com.playlistmigrator.service;

import com.playlistmigrator.error.MigrationException;
import com.playlistmigrator.model.Playlist;
import com.playlistmigrator.model.PlaylistExport;
import com.playlistmigrator.model.Track;

import java.util.List;
import java.util.Map;

/**
 * The capabilities the transfer engine needs from a music streaming service.
 * Each provider implements this on its own; providers share no base class.
 */
public interface MusicService {

    /**
     * Establishes a usable session.
     * @param credentials Provider-specific credential entries (e.g. "access_token").
     * @throws MigrationException with {@code NOT_AUTHENTICATED} if the credentials are incomplete.
     */
    void authenticate(Map<String, String> credentials) throws MigrationException;

    /**
     * @return Metadata of every playlist owned by the authenticated user. No track content.
     */
    List<Playlist> getPlaylists() throws MigrationException;

    /**
     * @return Metadata of one playlist. No track content.
     * @throws com.playlistmigrator.error.PlaylistNotFoundException if the ID is unknown.
     */
    Playlist getPlaylist(String playlistId) throws MigrationException;

    /**
     * Fetches a playlist with its complete, ordered track list.
     * @throws com.playlistmigrator.error.PlaylistNotFoundException if the ID is unknown.
     */
    PlaylistExport exportPlaylist(String playlistId) throws MigrationException;

    /**
     * Creates a new playlist and fills it with the given tracks, batching additions
     * when the provider limits how many items one call may add.
     * @return The created playlist, including its provider-assigned ID.
     */
    Playlist importPlaylist(PlaylistExport export) throws MigrationException;

    /**
     * @return The single best match for the title and artist.
     * @throws com.playlistmigrator.error.TrackNotFoundException if nothing matches.
     */
    Track searchTrack(String title, String artist) throws MigrationException;

    /**
     * @return A display label, used in descriptions and diagnostics only.
     */
    String name();
}
