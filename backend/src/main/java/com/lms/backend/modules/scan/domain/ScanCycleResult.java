package com.lms.backend.modules.scan.domain;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.lms.backend.modules.report.domain.ReportPaths;
import com.lms.backend.modules.report.domain.ScanReport;

/**
 * Terminal view of one scan cycle. A {@code DONE} cycle always has a report; its paths are absent when
 * the report could not be written. A {@code FAILED} cycle has neither and carries the failure reason.
 */
public record ScanCycleResult(
        UUID cycleId,
        ScanCycleState state,
        Optional<ScanReport> report,
        Optional<ReportPaths> reportPaths,
        Optional<String> failureReason
) {

    public ScanCycleResult {
        Objects.requireNonNull(cycleId, "cycleId is required");
        if (state != ScanCycleState.DONE && state != ScanCycleState.FAILED) {
            throw new IllegalArgumentException("result requires a terminal state, got " + state);
        }
        report = report == null ? Optional.empty() : report;
        reportPaths = reportPaths == null ? Optional.empty() : reportPaths;
        failureReason = failureReason == null ? Optional.empty() : failureReason;
        if (state == ScanCycleState.DONE && report.isEmpty()) {
            throw new IllegalArgumentException("completed cycle requires a report");
        }
        if (state == ScanCycleState.FAILED && failureReason.isEmpty()) {
            throw new IllegalArgumentException("failed cycle requires a reason");
        }
    }

    public static ScanCycleResult completed(UUID cycleId, ScanReport report, ReportPaths paths) {
        return new ScanCycleResult(cycleId, ScanCycleState.DONE, Optional.of(report),
                Optional.ofNullable(paths), Optional.empty());
    }

    public static ScanCycleResult failed(UUID cycleId, String reason) {
        return new ScanCycleResult(cycleId, ScanCycleState.FAILED, Optional.empty(),
                Optional.empty(), Optional.of(reason));
    }

    public boolean isFailed() {
        return state == ScanCycleState.FAILED;
    }

    public int sentCount() {
        return report.map(ScanReport::sentCount).orElse(0);
    }
}
