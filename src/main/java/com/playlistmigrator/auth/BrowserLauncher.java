package com.playlistmigrator.auth;

import com.google.api.client.extensions.java6.auth.oauth2.AuthorizationCodeInstalledApp;

import java.io.IOException;

/**
 * Opens a URL for the user. Launching is best-effort: callers log failures and carry on.
 */
@FunctionalInterface
public interface BrowserLauncher {

    void browse(String url) throws IOException;

    /**
     * @return A launcher using the desktop's default browser, which also prints the URL for manual navigation.
     */
    static BrowserLauncher system() {
        return AuthorizationCodeInstalledApp::browse;
    }
}
