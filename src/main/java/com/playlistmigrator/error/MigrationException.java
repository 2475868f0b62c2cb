package com.playlistmigrator.error;

import java.util.Objects;

/**
 * A classified failure raised by a music service, the transfer engine or the authorization flow.
 * The message always starts with the kind's description, e.g. "playlist not found: Road Trip".
 */
public class MigrationException extends Exception {

    private final ErrorKind kind;

    public MigrationException(ErrorKind kind, String detail) {
        this(kind, detail, null);
    }

    public MigrationException(ErrorKind kind, String detail, Throwable cause) {
        super(formatMessage(kind, detail), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean is(ErrorKind other) {
        return kind == other;
    }

    private static String formatMessage(ErrorKind kind, String detail) {
        if (detail == null || detail.isEmpty()) {
            return kind.description();
        }
        return kind.description() + ": " + detail;
    }
}
