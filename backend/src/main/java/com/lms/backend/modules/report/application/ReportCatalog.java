package com.lms.backend.modules.report.application;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.springframework.stereotype.Component;

/**
 * Lists and reads the human-readable reports in the report directory, newest first.
 */
@Component
public class ReportCatalog {

    private static final Pattern TIMESTAMP_IN_NAME = Pattern.compile("_(\\d{8}_\\d{6})(?:_[0-9a-f]{8})?\\.txt$");
    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String UNKNOWN_TIMESTAMP = "Unknown Timestamp";

    private static final Comparator<ReportListing> NEWEST_FIRST = Comparator
            .comparing((ReportListing listing) -> listing.generatedAt().orElse(LocalDateTime.MIN))
            .thenComparing(ReportListing::fileName)
            .reversed();

    private final ReportArtifactWriter artifactWriter;

    public ReportCatalog(ReportArtifactWriter artifactWriter) {
        this.artifactWriter = artifactWriter;
    }

    public List<ReportListing> listReports() {
        Path directory = artifactWriter.reportDirectory();
        if (!Files.isDirectory(directory)) {
            throw new ReportNotFoundException("report directory not found: " + directory);
        }

        List<ReportListing> unnumbered = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(path -> path.getFileName().toString().endsWith(ReportArtifactWriter.TEXT_SUFFIX))
                    .filter(Files::isRegularFile)
                    .forEach(path -> {
                        String name = path.getFileName().toString();
                        unnumbered.add(new ReportListing(0, name, path, parseTimestamp(name)));
                    });
        } catch (IOException ex) {
            throw new ReportNotFoundException("failed to list " + directory + ": " + ex.getMessage(), ex);
        }

        unnumbered.sort(NEWEST_FIRST);
        List<ReportListing> numbered = new ArrayList<>(unnumbered.size());
        for (int i = 0; i < unnumbered.size(); i++) {
            ReportListing listing = unnumbered.get(i);
            numbered.add(new ReportListing(i + 1, listing.fileName(), listing.path(), listing.generatedAt()));
        }
        return numbered;
    }

    /**
     * @param number 1-based position in {@link #listReports()}; 1 is the latest report
     */
    public String readReport(int number) {
        List<ReportListing> reports = listReports();
        if (reports.isEmpty()) {
            throw new ReportNotFoundException("no reports found in " + artifactWriter.reportDirectory());
        }
        if (number < 1 || number > reports.size()) {
            throw new ReportNotFoundException("invalid report number: " + number + " (1-" + reports.size() + ")");
        }

        Path path = reports.get(number - 1).path();
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ReportNotFoundException("failed to read " + path + ": " + ex.getMessage(), ex);
        }
    }

    static Optional<LocalDateTime> parseTimestamp(String fileName) {
        Matcher matcher = TIMESTAMP_IN_NAME.matcher(fileName);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(matcher.group(1), ReportArtifactWriter.FILE_TIMESTAMP));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    public record ReportListing(int number, String fileName, Path path, Optional<LocalDateTime> generatedAt) {

        public String displayTimestamp() {
            return generatedAt.map(DISPLAY_FORMAT::format).orElse(UNKNOWN_TIMESTAMP);
        }
    }
}
