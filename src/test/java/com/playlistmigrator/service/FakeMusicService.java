package com.playlistmigrator.service;

import com.playlistmigrator.error.ErrorKind;
import com.playlistmigrator.error.MigrationException;
import com.playlistmigrator.error.PlaylistNotFoundException;
import com.playlistmigrator.error.TrackNotFoundException;
import com.playlistmigrator.matching.TrackMatcher;
import com.playlistmigrator.model.Playlist;
import com.playlistmigrator.model.PlaylistExport;
import com.playlistmigrator.model.Track;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory service: playlists by ID and a searchable catalog keyed by normalized title/artist.
 */
public class FakeMusicService implements MusicService {

    private final String name;
    private final Map<String, PlaylistExport> playlists = new LinkedHashMap<>();
    private final Map<String, Track> catalog = new HashMap<>();
    private final List<PlaylistExport> imported = new ArrayList<>();
    private final List<String> searches = new ArrayList<>();
    private MigrationException searchFailure;
    private MigrationException importFailure;
    private MigrationException listFailure;
    private int nextId = 1;

    public FakeMusicService(String name) {
        this.name = name;
    }

    public FakeMusicService withPlaylist(String id, String playlistName, Track... tracks) {
        playlists.put(id, new PlaylistExport(new Playlist(id, playlistName, "", false, tracks.length), List.of(tracks)));
        return this;
    }

    public FakeMusicService withCatalog(Track... tracks) {
        for (Track track : tracks) {
            catalog.put(TrackMatcher.key(track), track);
        }
        return this;
    }

    public FakeMusicService failSearchesWith(MigrationException failure) {
        this.searchFailure = failure;
        return this;
    }

    public FakeMusicService failImportsWith(MigrationException failure) {
        this.importFailure = failure;
        return this;
    }

    public FakeMusicService failListingWith(MigrationException failure) {
        this.listFailure = failure;
        return this;
    }

    public List<PlaylistExport> imported() {
        return imported;
    }

    public List<String> searches() {
        return searches;
    }

    @Override
    public void authenticate(Map<String, String> credentials) throws MigrationException {
        if (!credentials.containsKey("access_token")) {
            throw new MigrationException(ErrorKind.NOT_AUTHENTICATED, "access_token is required");
        }
    }

    @Override
    public List<Playlist> getPlaylists() throws MigrationException {
        if (listFailure != null) {
            throw listFailure;
        }
        List<Playlist> result = new ArrayList<>();
        for (PlaylistExport export : playlists.values()) {
            result.add(export.playlist());
        }
        return result;
    }

    @Override
    public Playlist getPlaylist(String playlistId) throws MigrationException {
        return exportPlaylist(playlistId).playlist();
    }

    @Override
    public PlaylistExport exportPlaylist(String playlistId) throws MigrationException {
        PlaylistExport export = playlists.get(playlistId);
        if (export == null) {
            throw new PlaylistNotFoundException(playlistId);
        }
        return export;
    }

    @Override
    public Playlist importPlaylist(PlaylistExport export) throws MigrationException {
        if (importFailure != null) {
            throw importFailure;
        }
        String id = name.toLowerCase() + "-created-" + nextId++;
        Playlist created = new Playlist(id, export.playlist().name(), export.playlist().description(),
                export.playlist().publicVisible(), export.size());
        PlaylistExport stored = new PlaylistExport(created, export.tracks());
        imported.add(stored);
        playlists.put(id, stored);
        return created;
    }

    @Override
    public Track searchTrack(String title, String artist) throws MigrationException {
        searches.add(title + " / " + artist);
        if (searchFailure != null) {
            throw searchFailure;
        }
        Track found = catalog.get(TrackMatcher.key(title, artist));
        if (found == null) {
            throw new TrackNotFoundException(title + " by " + artist);
        }
        return found;
    }

    @Override
    public String name() {
        return name;
    }
}
