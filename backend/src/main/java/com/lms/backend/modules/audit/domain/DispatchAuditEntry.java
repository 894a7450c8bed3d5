package com.lms.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.lms.backend.modules.notification.domain.DispatchOutcome;
import com.lms.backend.modules.notification.domain.DispatchStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * Append-only record of one dispatch attempt, tagged with the scan cycle that made it.
 * Rows are inserted once and never updated.
 */
@Entity
@Immutable
@Table(name = "dispatch_audit_entry")
public class DispatchAuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "cycle_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID cycleId;

    @Column(name = "recipient_id", nullable = false, updatable = false)
    private Long recipientId;

    @Column(name = "recipient_email", length = 320, updatable = false)
    private String recipientEmail;

    @Column(name = "attempted_at", nullable = false, updatable = false)
    private OffsetDateTime attemptedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16, updatable = false)
    private DispatchStatus status;

    @Column(name = "reason", updatable = false)
    private String reason;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private OffsetDateTime recordedAt;

    protected DispatchAuditEntry() {
    }

    public static DispatchAuditEntry of(UUID cycleId, DispatchOutcome outcome, OffsetDateTime recordedAt) {
        DispatchAuditEntry entry = new DispatchAuditEntry();
        entry.cycleId = cycleId;
        entry.recipientId = outcome.recipientId();
        entry.recipientEmail = outcome.recipientEmail();
        entry.attemptedAt = outcome.attemptedAt();
        entry.status = outcome.status();
        entry.reason = outcome.failureReason();
        entry.recordedAt = recordedAt;
        return entry;
    }

    public Long getId() {
        return id;
    }

    public UUID getCycleId() {
        return cycleId;
    }

    public Long getRecipientId() {
        return recipientId;
    }

    public String getRecipientEmail() {
        return recipientEmail;
    }

    public OffsetDateTime getAttemptedAt() {
        return attemptedAt;
    }

    public DispatchStatus getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }

    public OffsetDateTime getRecordedAt() {
        return recordedAt;
    }
}
