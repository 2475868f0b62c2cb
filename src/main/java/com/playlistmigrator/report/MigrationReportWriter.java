package com.playlistmigrator.report;

import com.playlistmigrator.model.DiffResult;
import com.playlistmigrator.model.PlaylistExport;
import com.playlistmigrator.model.Track;
import com.playlistmigrator.model.TrackMatch;
import com.playlistmigrator.model.TransferResult;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Writes diff and transfer outcomes as Excel workbooks.
 */
public class MigrationReportWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MigrationReportWriter.class);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter DISPLAY_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String[] TRACK_HEADERS = {"Track ID", "Title", "Artist", "Album", "ISRC"};
    private static final int COLUMN_WIDTH = 32 * 256;

    private final Clock clock;

    public MigrationReportWriter() {
        this(Clock.systemDefaultZone());
    }

    MigrationReportWriter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Writes a workbook with Summary, Missing in Destination and Extra in Destination sheets.
     * @return The written file.
     */
    public Path writeDiffReport(DiffResult diff, Path outputDirectory) throws IOException {
        LocalDateTime now = LocalDateTime.now(clock);
        Path file = outputDirectory.resolve("Playlist_Diff_Report_" + now.format(FILE_TIMESTAMP) + ".xlsx");
        LOGGER.info("Writing diff report to {}", file);

        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = headerStyle(workbook);

            Sheet summary = workbook.createSheet("Summary");
            int rowNum = 0;
            title(summary, rowNum++, "Playlist Comparison Summary", headerStyle);
            pair(summary, rowNum++, "Report Generated", now.format(DISPLAY_TIMESTAMP));
            rowNum++;
            pair(summary, rowNum++, "Source Playlist", describe(diff.source()));
            pair(summary, rowNum++, "Destination Playlist", describe(diff.destination()));
            pair(summary, rowNum++, "Source Track Count", diff.source().size());
            pair(summary, rowNum++, "Destination Track Count", diff.destination().size());
            pair(summary, rowNum++, "Matched Tracks", diff.matchedCount());
            pair(summary, rowNum++, "Missing in Destination", diff.missingInDestination().size());
            pair(summary, rowNum++, "Extra in Destination", diff.extraInDestination().size());
            pair(summary, rowNum, "Status", diff.isInSync() ? "In Sync" : "Out of Sync");
            summary.setColumnWidth(0, COLUMN_WIDTH);
            summary.setColumnWidth(1, COLUMN_WIDTH);

            trackSheet(workbook.createSheet("Missing in Destination"), diff.missingInDestination(), headerStyle);
            trackSheet(workbook.createSheet("Extra in Destination"), diff.extraInDestination(), headerStyle);

            save(workbook, file);
        }
        return file;
    }

    /**
     * Writes a workbook with Summary and Unmatched Tracks sheets.
     * @return The written file.
     */
    public Path writeTransferReport(TransferResult result, Path outputDirectory) throws IOException {
        LocalDateTime now = LocalDateTime.now(clock);
        Path file = outputDirectory.resolve("Transfer_Report_" + now.format(FILE_TIMESTAMP) + ".xlsx");
        LOGGER.info("Writing transfer report to {}", file);

        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = headerStyle(workbook);

            Sheet summary = workbook.createSheet("Summary");
            int rowNum = 0;
            title(summary, rowNum++, "Playlist Transfer Summary", headerStyle);
            pair(summary, rowNum++, "Report Generated", now.format(DISPLAY_TIMESTAMP));
            rowNum++;
            pair(summary, rowNum++, "Source Playlist", describe(result.source()));
            pair(summary, rowNum++, "Created Playlist", result.destination() == null
                    ? "Not created"
                    : result.destination().name() + " (" + result.destination().id() + ")");
            pair(summary, rowNum++, "Total Tracks", result.totalTracks());
            pair(summary, rowNum++, "Matched", result.successCount());
            pair(summary, rowNum++, "Not Found", result.failedCount());
            pair(summary, rowNum, "Success Rate", String.format(Locale.ROOT, "%.1f%%", result.successRate()));
            summary.setColumnWidth(0, COLUMN_WIDTH);
            summary.setColumnWidth(1, COLUMN_WIDTH);

            Sheet unmatched = workbook.createSheet("Unmatched Tracks");
            String[] headers = {"Title", "Artist", "Album", "Reason"};
            header(unmatched, headers, headerStyle);
            int unmatchedRow = 1;
            for (TrackMatch match : result.matches()) {
                if (match.isMatched()) {
                    continue;
                }
                Track track = match.original();
                Row row = unmatched.createRow(unmatchedRow++);
                row.createCell(0).setCellValue(nullToEmpty(track.title()));
                row.createCell(1).setCellValue(nullToEmpty(track.artist()));
                row.createCell(2).setCellValue(nullToEmpty(track.album()));
                row.createCell(3).setCellValue(match.failure().getMessage());
            }
            widen(unmatched, headers.length);

            save(workbook, file);
        }
        return file;
    }

    private static void trackSheet(Sheet sheet, List<Track> tracks, CellStyle headerStyle) {
        header(sheet, TRACK_HEADERS, headerStyle);
        int rowNum = 1;
        for (Track track : tracks) {
            Row row = sheet.createRow(rowNum++);
            row.createCell(0).setCellValue(nullToEmpty(track.id()));
            row.createCell(1).setCellValue(nullToEmpty(track.title()));
            row.createCell(2).setCellValue(nullToEmpty(track.artist()));
            row.createCell(3).setCellValue(nullToEmpty(track.album()));
            row.createCell(4).setCellValue(nullToEmpty(track.isrc()));
        }
        widen(sheet, TRACK_HEADERS.length);
    }

    private static CellStyle headerStyle(Workbook workbook) {
        Font headerFont = workbook.createFont();
        headerFont.setBold(true);
        CellStyle headerCellStyle = workbook.createCellStyle();
        headerCellStyle.setFont(headerFont);
        return headerCellStyle;
    }

    private static void header(Sheet sheet, String[] headers, CellStyle style) {
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < headers.length; i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(headers[i]);
            cell.setCellStyle(style);
        }
    }

    private static void title(Sheet sheet, int rowNum, String text, CellStyle style) {
        Cell cell = sheet.createRow(rowNum).createCell(0);
        cell.setCellValue(text);
        cell.setCellStyle(style);
    }

    private static void pair(Sheet sheet, int rowNum, String label, String value) {
        Row row = sheet.createRow(rowNum);
        row.createCell(0).setCellValue(label);
        row.createCell(1).setCellValue(value);
    }

    private static void pair(Sheet sheet, int rowNum, String label, double value) {
        Row row = sheet.createRow(rowNum);
        row.createCell(0).setCellValue(label);
        row.createCell(1).setCellValue(value);
    }

    // autoSizeColumn needs font metrics, which headless hosts may lack
    private static void widen(Sheet sheet, int columns) {
        for (int i = 0; i < columns; i++) {
            sheet.setColumnWidth(i, COLUMN_WIDTH);
        }
    }

    private static void save(Workbook workbook, Path file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            workbook.write(out);
        }
    }

    private static String describe(PlaylistExport export) {
        return export.playlist().name() + " (" + export.playlist().id() + ")";
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
