package com.playlistmigrator.error;

import com.playlistmigrator.model.TransferResult;

/**
 * Thrown when a migration matched no track at all. No destination playlist is created in that case,
 * since an empty result points at an upstream problem (auth, rate limit, catalog) rather than a real migration.
 * The per-track breakdown stays available through {@link #getPartialResult()}.
 */
public class EmptyResultSetException extends MigrationException {

    private final transient TransferResult partialResult;

    public EmptyResultSetException(String message, TransferResult partialResult) {
        super(ErrorKind.EMPTY_RESULT_SET, message);
        this.partialResult = partialResult;
    }

    public TransferResult getPartialResult() {
        return partialResult;
    }
}
