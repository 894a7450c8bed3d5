package com.lms.backend.modules.report.domain;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Summary of one scan cycle. {@code sentCount + failedCount == totalCandidates} always holds.
 */
public record ScanReport(
        UUID cycleId,
        OffsetDateTime startedAt,
        OffsetDateTime finishedAt,
        long thresholdDays,
        int totalCandidates,
        int sentCount,
        int failedCount,
        int neverActiveCount,
        List<FailedRecipient> failures,
        List<String> warnings
) {

    public ScanReport {
        Objects.requireNonNull(cycleId, "cycleId is required");
        Objects.requireNonNull(startedAt, "startedAt is required");
        Objects.requireNonNull(finishedAt, "finishedAt is required");
        if (sentCount + failedCount != totalCandidates) {
            throw new IllegalArgumentException("sent + failed must equal total candidates: "
                    + sentCount + " + " + failedCount + " != " + totalCandidates);
        }
        failures = failures == null ? List.of() : List.copyOf(failures);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public record FailedRecipient(long recipientId, String email, String reason) {
    }
}
