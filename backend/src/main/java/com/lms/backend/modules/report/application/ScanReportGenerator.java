package com.lms.backend.modules.report.application;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.lms.backend.modules.activity.domain.InactivityThreshold;
import com.lms.backend.modules.notification.domain.DispatchOutcome;
import com.lms.backend.modules.report.domain.ReportPaths;
import com.lms.backend.modules.report.domain.ScanReport;
import com.lms.backend.modules.report.domain.ScanReport.FailedRecipient;

import org.springframework.stereotype.Component;

@Component
public class ScanReportGenerator {

    public static final String FILE_PREFIX = "inactivity_report_";
    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "=".repeat(50);
    private static final String SUB_RULE = "-".repeat(20);

    private final ReportArtifactWriter artifactWriter;

    public ScanReportGenerator(ReportArtifactWriter artifactWriter) {
        this.artifactWriter = artifactWriter;
    }

    public ScanReport summarize(
            UUID cycleId,
            OffsetDateTime startedAt,
            OffsetDateTime finishedAt,
            InactivityThreshold threshold,
            List<DispatchOutcome> outcomes,
            int neverActiveCount,
            List<String> warnings
    ) {
        int sent = 0;
        List<FailedRecipient> failures = new ArrayList<>();
        for (DispatchOutcome outcome : outcomes) {
            if (outcome.isSent()) {
                sent++;
            } else {
                failures.add(new FailedRecipient(outcome.recipientId(), outcome.recipientEmail(), outcome.failureReason()));
            }
        }

        return new ScanReport(
                cycleId,
                startedAt,
                finishedAt,
                threshold.toDays(),
                outcomes.size(),
                sent,
                failures.size(),
                neverActiveCount,
                failures,
                warnings
        );
    }

    /**
     * Writes both forms of the report. Names are keyed by the cycle's end time plus the cycle id prefix.
     *
     * @throws ReportPersistException when either file cannot be written
     */
    public ReportPaths persist(ScanReport report) {
        return artifactWriter.write(baseName(report), report, renderText(report));
    }

    static String baseName(ScanReport report) {
        return FILE_PREFIX + ReportArtifactWriter.timestampKey(report.finishedAt())
                + "_" + report.cycleId().toString().substring(0, 8);
    }

    String renderText(ScanReport report) {
        StringBuilder text = new StringBuilder();
        text.append("LMS Inactivity Scan Report\n")
                .append("Cycle: ").append(report.cycleId()).append('\n')
                .append("Started: ").append(display(report.startedAt())).append('\n')
                .append("Finished: ").append(display(report.finishedAt())).append('\n')
                .append(RULE).append("\n\n");

        text.append("SUMMARY\n").append(SUB_RULE).append('\n')
                .append("Inactivity threshold: ").append(report.thresholdDays()).append(" days\n")
                .append("Inactive candidates: ").append(report.totalCandidates()).append('\n')
                .append("Sent: ").append(report.sentCount()).append('\n')
                .append("Failed: ").append(report.failedCount()).append('\n')
                .append("Never active: ").append(report.neverActiveCount()).append("\n\n");

        text.append("FAILED RECIPIENTS\n").append(SUB_RULE).append('\n');
        if (report.failures().isEmpty()) {
            text.append("None\n");
        }
        for (FailedRecipient failure : report.failures()) {
            text.append("User ").append(failure.recipientId());
            if (failure.email() != null && !failure.email().isBlank()) {
                text.append(" <").append(failure.email()).append('>');
            }
            text.append(": failed: ").append(failure.reason()).append('\n');
        }

        if (!report.warnings().isEmpty()) {
            text.append("\nWARNINGS\n").append(SUB_RULE).append('\n');
            report.warnings().forEach(warning -> text.append("- ").append(warning).append('\n'));
        }
        return text.toString();
    }

    private static String display(OffsetDateTime time) {
        return time.withOffsetSameInstant(ZoneOffset.UTC).format(DISPLAY_FORMAT) + " UTC";
    }
}
