package com.playlistmigrator.model;

/**
 * Playlist metadata. Carries no track content.
 *
 * @param id          The provider-assigned playlist ID, {@code null} for a playlist that was not created yet.
 * @param name        The playlist name.
 * @param description The playlist description, possibly empty.
 * @param publicVisible Whether the playlist is publicly visible.
 * @param trackCount  The number of tracks as reported by the provider.
 */
public record Playlist(
    String id,
    String name,
    String description,
    boolean publicVisible,
    int trackCount
) {
    public Playlist withTrackCount(int newTrackCount) {
        return new Playlist(this.id, this.name, this.description, this.publicVisible, newTrackCount);
    }
}
