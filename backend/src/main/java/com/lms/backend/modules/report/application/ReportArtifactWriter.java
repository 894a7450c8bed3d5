package com.lms.backend.modules.report.application;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lms.backend.modules.report.domain.ReportPaths;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Writes the JSON and plain-text forms of a report side by side in the report directory.
 * Files are created, never overwritten: a name clash is reported as a failure.
 */
@Component
public class ReportArtifactWriter {

    public static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    public static final String JSON_SUFFIX = ".json";
    public static final String TEXT_SUFFIX = ".txt";

    private final ObjectMapper objectMapper;
    private final Path reportDirectory;

    public ReportArtifactWriter(
            ObjectMapper objectMapper,
            @Value("${lms.reports.directory}") String reportDirectory
    ) {
        this.objectMapper = objectMapper;
        this.reportDirectory = Paths.get(reportDirectory).toAbsolutePath().normalize();
    }

    public Path reportDirectory() {
        return reportDirectory;
    }

    public static String timestampKey(OffsetDateTime time) {
        return time.withOffsetSameInstant(ZoneOffset.UTC).format(FILE_TIMESTAMP);
    }

    public ReportPaths write(String baseName, Object jsonPayload, String textBody) {
        Path jsonPath = reportDirectory.resolve(baseName + JSON_SUFFIX);
        Path textPath = reportDirectory.resolve(baseName + TEXT_SUFFIX);
        try {
            Files.createDirectories(reportDirectory);
            try (BufferedWriter writer = Files.newBufferedWriter(jsonPath, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, jsonPayload);
            }
        } catch (IOException ex) {
            throw persistFailure(baseName, ex);
        }
        try {
            Files.writeString(textPath, textBody, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException ex) {
            ReportPersistException failure = persistFailure(baseName, ex);
            // the pair is written together or not at all
            try {
                Files.deleteIfExists(jsonPath);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
        return new ReportPaths(jsonPath, textPath);
    }

    private ReportPersistException persistFailure(String baseName, IOException ex) {
        return new ReportPersistException("failed to write " + baseName + " to " + reportDirectory + ": " + ex.getMessage(), ex);
    }
}
