package com.playlistmigrator.service;

import com.playlistmigrator.error.ErrorKind;
import com.playlistmigrator.error.MigrationException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves service labels given by the user ("spotify", "youtube", "ytmusic", ...) to configured services.
 * A label may be known without a service being configured for it, e.g. when credentials are missing.
 */
public class ServiceRegistry {

    private final Map<String, String> aliases = new LinkedHashMap<>();
    private final Map<String, MusicService> services = new LinkedHashMap<>();

    /**
     * Declares a label and its aliases. The label is resolvable from now on, even before a service is attached.
     */
    public ServiceRegistry declare(String label, String... labelAliases) {
        String canonical = canonicalize(label);
        aliases.put(canonical, canonical);
        for (String alias : labelAliases) {
            aliases.put(canonicalize(alias), canonical);
        }
        return this;
    }

    /**
     * Attaches a configured service to a label, declaring the label if necessary.
     */
    public ServiceRegistry register(String label, MusicService service, String... labelAliases) {
        declare(label, labelAliases);
        services.put(canonicalize(label), service);
        return this;
    }

    /**
     * @param label A label or alias, matched case-insensitively.
     * @return The configured service.
     * @throws MigrationException {@code MISSING_ARGUMENT} for a blank label, {@code INVALID_ARGUMENT} for an unknown one,
     *                            {@code SERVICE_UNAVAILABLE} if the label is known but nothing is configured for it.
     */
    public MusicService resolve(String label) throws MigrationException {
        if (label == null || label.isBlank()) {
            throw new MigrationException(ErrorKind.MISSING_ARGUMENT, "service label");
        }
        String canonical = aliases.get(canonicalize(label));
        if (canonical == null) {
            throw new MigrationException(ErrorKind.INVALID_ARGUMENT,
                    String.format("unknown service '%s' (must be one of %s)", label, aliases.keySet()));
        }
        MusicService service = services.get(canonical);
        if (service == null) {
            throw new MigrationException(ErrorKind.SERVICE_UNAVAILABLE, canonical + " service not initialized");
        }
        return service;
    }

    public Set<String> labels() {
        return Set.copyOf(aliases.keySet());
    }

    private static String canonicalize(String label) {
        return label.trim().toLowerCase(Locale.ROOT);
    }
}
