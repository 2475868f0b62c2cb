package com.playlistmigrator.report;

import com.playlistmigrator.error.TrackNotFoundException;
import com.playlistmigrator.model.DiffResult;
import com.playlistmigrator.model.Playlist;
import com.playlistmigrator.model.PlaylistExport;
import com.playlistmigrator.model.Track;
import com.playlistmigrator.model.TrackMatch;
import com.playlistmigrator.model.TransferResult;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

class MigrationReportWriterTest {

    private static final Track SONG_A = new Track("a", "Song A", "Artist X", "Album", 200, "ISRC-A");
    private static final Track SONG_B = new Track("b", "Song B", "Artist Y");
    private static final PlaylistExport SOURCE = new PlaylistExport(
            new Playlist("src", "Road Trip", "", false, 2), List.of(SONG_A, SONG_B));

    @TempDir
    Path outputDir;

    private final MigrationReportWriter writer = new MigrationReportWriter(
            Clock.fixed(Instant.parse("2026-03-04T05:06:07Z"), ZoneOffset.UTC));

    @Test
    void shouldWriteDiffWorkbook() throws IOException {
        Track extra = new Track("x", "Extra", "Someone");
        PlaylistExport destination = new PlaylistExport(
                new Playlist("dst", "Road Trip Copy", "", false, 2), List.of(SONG_A, extra));
        DiffResult diff = new DiffResult(SOURCE, destination, 1, List.of(SONG_B), List.of(extra));

        Path file = writer.writeDiffReport(diff, outputDir);

        Assertions.assertEquals("Playlist_Diff_Report_20260304_050607.xlsx", file.getFileName().toString());
        try (Workbook workbook = open(file)) {
            Assertions.assertEquals(3, workbook.getNumberOfSheets());
            Sheet summary = workbook.getSheet("Summary");
            Assertions.assertEquals("Playlist Comparison Summary", summary.getRow(0).getCell(0).getStringCellValue());
            Assertions.assertEquals("Out of Sync", summary.getRow(10).getCell(1).getStringCellValue());

            Sheet missing = workbook.getSheet("Missing in Destination");
            Assertions.assertEquals("Track ID", missing.getRow(0).getCell(0).getStringCellValue());
            Assertions.assertEquals("Song B", missing.getRow(1).getCell(1).getStringCellValue());
            Assertions.assertEquals("", missing.getRow(1).getCell(4).getStringCellValue());

            Sheet extraSheet = workbook.getSheet("Extra in Destination");
            Assertions.assertEquals("Extra", extraSheet.getRow(1).getCell(1).getStringCellValue());
            Assertions.assertNull(extraSheet.getRow(2));
        }
    }

    @Test
    void shouldWriteTransferWorkbook() throws IOException {
        TransferResult result = TransferResult.of(SOURCE, new Playlist("new", "Copy", "", false, 1), List.of(
                TrackMatch.found(SONG_A, new Track("v1", "Song A", "Artist X")),
                TrackMatch.notFound(SONG_B, new TrackNotFoundException("Song B Artist Y"))));

        Path file = writer.writeTransferReport(result, outputDir);

        try (Workbook workbook = open(file)) {
            Sheet summary = workbook.getSheet("Summary");
            Assertions.assertEquals("Copy (new)", summary.getRow(4).getCell(1).getStringCellValue());
            Assertions.assertEquals(2.0, summary.getRow(5).getCell(1).getNumericCellValue());
            Assertions.assertEquals("50.0%", summary.getRow(8).getCell(1).getStringCellValue());

            Sheet unmatched = workbook.getSheet("Unmatched Tracks");
            Assertions.assertEquals("Song B", unmatched.getRow(1).getCell(0).getStringCellValue());
            Assertions.assertEquals("track not found: Song B Artist Y",
                    unmatched.getRow(1).getCell(3).getStringCellValue());
            Assertions.assertNull(unmatched.getRow(2));
        }
    }

    @Test
    void shouldPropagateWriteFailure() {
        Path missingDir = outputDir.resolve("does-not-exist");
        DiffResult diff = new DiffResult(SOURCE, SOURCE, 2, List.of(), List.of());

        Assertions.assertThrows(IOException.class, () -> writer.writeDiffReport(diff, missingDir));
    }

    private static Workbook open(Path file) throws IOException {
        Assertions.assertTrue(Files.exists(file));
        try (InputStream in = Files.newInputStream(file)) {
            return new XSSFWorkbook(in);
        }
    }
}
