package com.lms.backend.modules.notification.domain;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Result of one notification attempt. {@code failureReason} is present exactly when the status is
 * {@link DispatchStatus#FAILED}.
 */
public record DispatchOutcome(
        long recipientId,
        String recipientEmail,
        OffsetDateTime attemptedAt,
        DispatchStatus status,
        String failureReason
) {

    public DispatchOutcome {
        Objects.requireNonNull(attemptedAt, "attemptedAt is required");
        Objects.requireNonNull(status, "status is required");
        recipientEmail = recipientEmail == null ? "" : recipientEmail;
        if (status == DispatchStatus.FAILED && (failureReason == null || failureReason.isBlank())) {
            throw new IllegalArgumentException("failed outcome requires a reason");
        }
        if (status == DispatchStatus.SENT && failureReason != null) {
            throw new IllegalArgumentException("sent outcome must not carry a reason");
        }
    }

    public static DispatchOutcome sent(long recipientId, String recipientEmail, OffsetDateTime attemptedAt) {
        return new DispatchOutcome(recipientId, recipientEmail, attemptedAt, DispatchStatus.SENT, null);
    }

    public static DispatchOutcome failed(
            long recipientId,
            String recipientEmail,
            OffsetDateTime attemptedAt,
            String reason
    ) {
        return new DispatchOutcome(recipientId, recipientEmail, attemptedAt, DispatchStatus.FAILED, reason);
    }

    public boolean isSent() {
        return status == DispatchStatus.SENT;
    }

    /**
     * Same attempt, reported as failed. Used when a delivered message could not be audited.
     */
    public DispatchOutcome downgrade(String reason) {
        return failed(recipientId, recipientEmail, attemptedAt, reason);
    }
}
