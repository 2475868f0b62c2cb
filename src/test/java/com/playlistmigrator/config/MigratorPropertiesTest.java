package com.playlistmigrator.config;

import com.playlistmigrator.auth.OAuthSettings;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

class MigratorPropertiesTest {

    @Test
    void shouldLoadClasspathFile() {
        MigratorProperties properties = MigratorProperties.load();

        OAuthSettings oauth = properties.oauthSettings();
        Assertions.assertEquals("test-client", oauth.clientId());
        Assertions.assertEquals(List.of("playlist-read-private", "playlist-modify-private"), oauth.scopes());
        Assertions.assertEquals("http://127.0.0.1:18080/callback", oauth.redirectUri());
        Assertions.assertEquals(Duration.ofSeconds(30), oauth.timeout());
        Assertions.assertEquals(Duration.ofSeconds(5), oauth.shutdownGrace());
        Assertions.assertEquals(4, properties.progressQueueCapacity());
        Assertions.assertEquals(2, properties.importBatchSize());
        Assertions.assertEquals("Migrated from", properties.descriptionPrefix());
    }

    @Test
    void shouldFallBackToDefaults() {
        MigratorProperties properties = new MigratorProperties(new Properties());

        OAuthSettings oauth = properties.oauthSettings();
        Assertions.assertEquals("https://oauth2.googleapis.com/token", oauth.tokenUrl());
        Assertions.assertEquals(8080, oauth.callbackPort());
        Assertions.assertEquals(Duration.ofMinutes(2), oauth.timeout());
        Assertions.assertEquals(32, properties.progressQueueCapacity());
        Assertions.assertEquals(100, properties.importBatchSize());
        Assertions.assertEquals(Path.of("."), properties.reportOutputDir());
    }

    @Test
    void shouldRejectMalformedNumbers() {
        Properties raw = new Properties();
        raw.setProperty("progress.queue.capacity", "lots");

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new MigratorProperties(raw).progressQueueCapacity());
    }

    @Test
    void shouldNormalizeCallbackPath() {
        Properties raw = new Properties();
        raw.setProperty("oauth.callback.path", "oauth/done");

        Assertions.assertEquals("/oauth/done", new MigratorProperties(raw).oauthSettings().callbackPath());
    }
}
