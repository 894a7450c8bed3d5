package com.lms.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.lms.backend.modules.audit.domain.DispatchAuditEntry;
import com.lms.backend.modules.audit.infrastructure.DispatchAuditEntryRepository;
import com.lms.backend.modules.notification.domain.DispatchOutcome;
import com.lms.backend.modules.notification.domain.DispatchStatus;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Audit trail of inactivity dispatch attempts. Each append commits in its own transaction and is flushed
 * before {@link #record} returns, so concurrent dispatch workers never share a unit of work.
 */
@Service
public class DispatchAuditService {

    private final DispatchAuditEntryRepository repository;
    private final Clock clock;

    public DispatchAuditService(DispatchAuditEntryRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(UUID cycleId, DispatchOutcome outcome) {
        Objects.requireNonNull(cycleId, "cycleId is required");
        Objects.requireNonNull(outcome, "outcome is required");
        try {
            repository.saveAndFlush(DispatchAuditEntry.of(cycleId, outcome, OffsetDateTime.now(clock)));
        } catch (DataAccessException ex) {
            throw new AuditWriteException(
                    "cycle=" + cycleId + " recipient=" + outcome.recipientId() + ": " + ex.getMostSpecificCause().getMessage(),
                    ex
            );
        }
    }

    @Transactional(readOnly = true)
    public List<DispatchAuditEntry> recent(UUID cycleId) {
        try {
            return repository.findByCycleIdOrderByAttemptedAtAscIdAsc(cycleId);
        } catch (DataAccessException ex) {
            throw new AuditReadException("cycle=" + cycleId + ": " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    /**
     * Within-cycle guard against dispatching twice to the same recipient.
     */
    @Transactional(readOnly = true)
    public boolean alreadySent(UUID cycleId, long recipientId) {
        try {
            return repository.existsByCycleIdAndRecipientIdAndStatus(cycleId, recipientId, DispatchStatus.SENT);
        } catch (DataAccessException ex) {
            throw new AuditReadException("cycle=" + cycleId + " recipient=" + recipientId + ": "
                    + ex.getMostSpecificCause().getMessage(), ex);
        }
    }
}
