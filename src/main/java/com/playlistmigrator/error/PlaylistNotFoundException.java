package com.playlistmigrator.error;

public class PlaylistNotFoundException extends MigrationException {
    public PlaylistNotFoundException(String message) {
        super(ErrorKind.PLAYLIST_NOT_FOUND, message);
    }

    public PlaylistNotFoundException(String message, Throwable cause) {
        super(ErrorKind.PLAYLIST_NOT_FOUND, message, cause);
    }
}
