package com.playlistmigrator.config;

import com.playlistmigrator.auth.OAuthSettings;
import com.playlistmigrator.engine.TransferEngine;
import com.playlistmigrator.service.ImportBatches;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Application settings read from {@code migrator.properties} on the classpath. Every key has a default.
 */
public class MigratorProperties {

    private static final Logger LOGGER = LoggerFactory.getLogger(MigratorProperties.class);

    public static final String RESOURCE = "/migrator.properties";

    static final String DEFAULT_AUTHORIZATION_URL = "https://accounts.google.com/o/oauth2/auth";
    static final String DEFAULT_TOKEN_URL = "https://oauth2.googleapis.com/token";
    static final String DEFAULT_SCOPES = "https://www.googleapis.com/auth/youtube";

    private final Properties props;

    public MigratorProperties(Properties props) {
        this.props = props;
    }

    /**
     * Loads {@link #RESOURCE}; a missing file leaves every setting at its default.
     * @throws UncheckedIOException if the file exists but cannot be read.
     */
    public static MigratorProperties load() {
        Properties props = new Properties();
        try (InputStream input = MigratorProperties.class.getResourceAsStream(RESOURCE)) {
            if (input == null) {
                LOGGER.warn("Unable to find {}, using defaults.", RESOURCE);
            } else {
                props.load(input);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error loading " + RESOURCE, e);
        }
        return new MigratorProperties(props);
    }

    public OAuthSettings oauthSettings() {
        return new OAuthSettings(
                props.getProperty("oauth.client.id", ""),
                props.getProperty("oauth.client.secret", ""),
                props.getProperty("oauth.authorization.url", DEFAULT_AUTHORIZATION_URL),
                props.getProperty("oauth.token.url", DEFAULT_TOKEN_URL),
                scopes(),
                props.getProperty("oauth.callback.host", "127.0.0.1"),
                getInt("oauth.callback.port", 8080),
                props.getProperty("oauth.callback.path", "/callback"),
                Duration.ofSeconds(getInt("oauth.timeout.seconds", 120)),
                Duration.ofSeconds(getInt("oauth.shutdown.grace.seconds", 5)));
    }

    List<String> scopes() {
        return Arrays.stream(props.getProperty("oauth.scopes", DEFAULT_SCOPES).split(","))
                .map(String::trim)
                .filter(scope -> !scope.isEmpty())
                .collect(Collectors.toList());
    }

    public int progressQueueCapacity() {
        return getInt("progress.queue.capacity", 32);
    }

    public int importBatchSize() {
        return getInt("import.batch.size", ImportBatches.DEFAULT_BATCH_SIZE);
    }

    public String descriptionPrefix() {
        return props.getProperty("transfer.description.prefix", TransferEngine.DEFAULT_DESCRIPTION_PREFIX);
    }

    public Path reportOutputDir() {
        return Path.of(props.getProperty("report.output.dir", "."));
    }

    private int getInt(String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: " + value, e);
        }
    }
}
