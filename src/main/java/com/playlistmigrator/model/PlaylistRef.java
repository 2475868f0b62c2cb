package com.playlistmigrator.model;

/**
 * Points at one playlist on one configured service.
 *
 * @param serviceLabel The service label, e.g. "spotify" or "youtube".
 * @param playlistId   The playlist ID on that service.
 */
public record PlaylistRef(String serviceLabel, String playlistId) {
}
