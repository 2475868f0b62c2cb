package com.playlistmigrator.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.playlistmigrator.model.PlaylistExport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Saves playlist exports as pretty-printed JSON, one file per playlist.
 */
public class PlaylistJsonWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlaylistJsonWriter.class);

    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    /**
     * @return The written file, {@code <playlist-id>.json} inside {@code outputDirectory}.
     */
    public Path write(PlaylistExport export, Path outputDirectory) throws IOException {
        String id = export.playlist().id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Cannot name an export file for a playlist without an ID");
        }
        Files.createDirectories(outputDirectory);
        Path file = outputDirectory.resolve(UNSAFE_FILE_CHARS.matcher(id).replaceAll("_") + ".json");
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(export, writer);
        }
        LOGGER.info("Exported playlist '{}' ({} tracks) to {}", export.playlist().name(), export.size(), file);
        return file;
    }

    public PlaylistExport read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return gson.fromJson(reader, PlaylistExport.class);
        }
    }
}
