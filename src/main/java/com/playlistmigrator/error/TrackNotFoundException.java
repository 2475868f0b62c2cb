package com.playlistmigrator.error;

public class TrackNotFoundException extends MigrationException {
    public TrackNotFoundException(String message) {
        super(ErrorKind.TRACK_NOT_FOUND, message);
    }

    public TrackNotFoundException(String message, Throwable cause) {
        super(ErrorKind.TRACK_NOT_FOUND, message, cause);
    }
}
