package com.slicereport.logging;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Appends skipped or degraded report items to a CSV next to the exports so a run can be
 * reviewed after the console output is gone.
 */
public final class ReportIssueLog {

    public static final String DEFAULT_FILENAME = "report-issues.csv";

    private static final Logger LOGGER = AppLogger.get();
    private static final String HEADER = "timestamp,axis,slice,quantity,stage,path,message";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private final Path logFile;

    public ReportIssueLog(Path logFile) {
        this.logFile = logFile;
    }

    public static ReportIssueLog inExportRoot(Path exportRoot) {
        return new ReportIssueLog(exportRoot.resolve(DEFAULT_FILENAME));
    }

    /** A log that only goes to the console. */
    public static ReportIssueLog disabled() {
        return new ReportIssueLog(null);
    }

    public Path logFile() {
        return logFile;
    }

    public void record(String axis, Integer sliceIndex, String quantity, String stage, Path path, String message) {
        if (logFile == null) {
            return;
        }
        String[] columns = new String[] {
            TIMESTAMP_FORMAT.format(Instant.now()),
            axis != null ? axis : "",
            sliceIndex != null ? sliceIndex.toString() : "",
            quantity != null ? quantity : "",
            stage != null ? stage : "",
            path == null ? "" : path.toString(),
            message != null ? message : ""
        };
        writeRow(columns);
    }

    private synchronized void writeRow(String[] columns) {
        try {
            if (logFile.getParent() != null) {
                Files.createDirectories(logFile.getParent());
            }
            boolean fileExists = Files.exists(logFile);
            try (BufferedWriter writer = Files.newBufferedWriter(
                logFile,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            )) {
                if (!fileExists) {
                    writer.write(HEADER);
                    writer.newLine();
                }
                writer.write(toCsv(columns));
                writer.newLine();
            }
        } catch (IOException ioEx) {
            LOGGER.log(Level.WARNING, "Failed to write report issue log " + logFile + ": " + ioEx.getMessage());
        }
    }

    static String toCsv(String[] columns) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < columns.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(columns[i]));
        }
        return sb.toString();
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        boolean needsQuotes = value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r");
        String escaped = value.replace("\"", "\"\"");
        if (needsQuotes) {
            return "\"" + escaped + "\"";
        }
        return escaped;
    }
}
