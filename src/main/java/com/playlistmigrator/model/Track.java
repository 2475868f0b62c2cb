package com.playlistmigrator.model;

/**
 * A track as reported by one music service.
 *
 * @param id              The provider-scoped track ID (a Spotify track ID, a YouTube video ID, ...).
 * @param title           The track title.
 * @param artist          The primary artist name.
 * @param album           The album name, or {@code null} if the provider did not report one.
 * @param durationSeconds The duration in seconds, {@code 0} when unknown.
 * @param isrc            The International Standard Recording Code, or {@code null} if absent.
 */
public record Track(
    String id,
    String title,
    String artist,
    String album,
    int durationSeconds,
    String isrc
) {
    public Track(String id, String title, String artist) {
        this(id, title, artist, null, 0, null);
    }

    public boolean hasIsrc() {
        return isrc != null && !isrc.isEmpty();
    }
}
