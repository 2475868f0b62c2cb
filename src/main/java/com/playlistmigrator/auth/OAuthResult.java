package com.playlistmigrator.auth;

import com.playlistmigrator.error.MigrationException;

import java.util.Optional;

/**
 * The single outcome of one authorization attempt: a token or a classified failure, never both and never neither.
 */
public final class OAuthResult {

    private final OAuthToken token;
    private final MigrationException failure;

    private OAuthResult(OAuthToken token, MigrationException failure) {
        if ((token == null) == (failure == null)) {
            throw new IllegalArgumentException("An OAuth result holds exactly one of token and failure");
        }
        this.token = token;
        this.failure = failure;
    }

    public static OAuthResult success(OAuthToken token) {
        return new OAuthResult(token, null);
    }

    public static OAuthResult failure(MigrationException failure) {
        return new OAuthResult(null, failure);
    }

    public boolean isSuccess() {
        return token != null;
    }

    public Optional<OAuthToken> token() {
        return Optional.ofNullable(token);
    }

    public Optional<MigrationException> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * @return The token.
     * @throws MigrationException the failure, if this result is one.
     */
    public OAuthToken tokenOrThrow() throws MigrationException {
        if (failure != null) {
            throw failure;
        }
        return token;
    }

    @Override
    public String toString() {
        return isSuccess() ? "OAuthResult[success]" : "OAuthResult[failure=" + failure.getMessage() + "]";
    }
}
