package com.playlistmigrator.auth;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates CSRF state tokens for authorization requests.
 */
public final class StateTokens {

    private static final int STATE_BYTES = 32;
    private static final SecureRandom RANDOM = new SecureRandom();

    private StateTokens() {
    }

    /**
     * @return 32 bytes of cryptographically secure randomness, URL-safe Base64 encoded.
     */
    public static String generate() {
        byte[] bytes = new byte[STATE_BYTES];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().encodeToString(bytes);
    }
}
