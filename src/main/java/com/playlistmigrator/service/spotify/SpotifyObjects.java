package com.playlistmigrator.service.spotify;

import com.google.api.client.util.Key;

import java.util.List;

/**
 * Web API response objects, bound by field name. Fields the migrator does not read are left out.
 */
public final class SpotifyObjects {

    private SpotifyObjects() {
    }

    public static class PlaylistPage {
        @Key
        public List<SimplePlaylist> items;
        @Key
        public int total;
        @Key
        public String next;
    }

    public static class PlaylistTrackPage {
        @Key
        public List<PlaylistTrack> items;
        @Key
        public int total;
        @Key
        public String next;
    }

    public static class TrackCount {
        @Key
        public int total;
    }

    public static class SimplePlaylist {
        @Key
        public String id;
        @Key
        public String name;
        @Key
        public String description;
        @Key("public")
        public Boolean isPublic;
        @Key
        public TrackCount tracks;
    }

    public static class FullPlaylist {
        @Key
        public String id;
        @Key
        public String name;
        @Key
        public String description;
        @Key("public")
        public Boolean isPublic;
        @Key
        public PlaylistTrackPage tracks;
    }

    public static class PlaylistTrack {
        @Key("added_at")
        public String addedAt;
        @Key
        public FullTrack track;
    }

    public static class FullTrack {
        @Key
        public String id;
        @Key
        public String name;
        @Key
        public List<Artist> artists;
        @Key
        public Album album;
        @Key("duration_ms")
        public int durationMs;
        @Key("external_ids")
        public ExternalIds externalIds;
    }

    public static class Artist {
        @Key
        public String name;
    }

    public static class Album {
        @Key
        public String name;
    }

    public static class ExternalIds {
        @Key
        public String isrc;
    }
}
