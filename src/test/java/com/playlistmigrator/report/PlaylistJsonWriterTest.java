package com.playlistmigrator.report;

import com.playlistmigrator.model.Playlist;
import com.playlistmigrator.model.PlaylistExport;
import com.playlistmigrator.model.Track;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

class PlaylistJsonWriterTest {

    @TempDir
    Path outputDir;

    private final PlaylistJsonWriter writer = new PlaylistJsonWriter();

    @Test
    void shouldWritePrettyJsonNamedAfterPlaylist() throws IOException {
        PlaylistExport export = new PlaylistExport(new Playlist("37i9dQZF1DX", "Rock & Roll", "<best>", true, 1),
                List.of(new Track("t1", "Song", "Band", "Album", 215, "USRC1")));

        Path file = writer.write(export, outputDir.resolve("exports"));

        Assertions.assertEquals("37i9dQZF1DX.json", file.getFileName().toString());
        String json = Files.readString(file, StandardCharsets.UTF_8);
        Assertions.assertTrue(json.contains("\n  \"playlist\": {"));
        Assertions.assertTrue(json.contains("\"name\": \"Rock & Roll\""));
        Assertions.assertTrue(json.contains("\"durationSeconds\": 215"));
        Assertions.assertEquals(export, writer.read(file));
    }

    @Test
    void shouldSanitizeUnsafeIds() throws IOException {
        PlaylistExport export = new PlaylistExport(new Playlist("a/b:c", "Mix", "", false, 0), List.of());

        Path file = writer.write(export, outputDir);

        Assertions.assertEquals("a_b_c.json", file.getFileName().toString());
    }

    @Test
    void shouldRejectExportWithoutId() {
        PlaylistExport export = new PlaylistExport(new Playlist(null, "Mix", "", false, 0), List.of());

        Assertions.assertThrows(IllegalArgumentException.class, () -> writer.write(export, outputDir));
    }
}
