package com.lms.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.lms.backend.modules.audit.domain.DispatchAuditEntry;
import com.lms.backend.modules.notification.domain.DispatchStatus;

public interface DispatchAuditEntryRepository extends JpaRepository<DispatchAuditEntry, Long> {

    List<DispatchAuditEntry> findByCycleIdOrderByAttemptedAtAscIdAsc(UUID cycleId);

    boolean existsByCycleIdAndRecipientIdAndStatus(UUID cycleId, Long recipientId, DispatchStatus status);

    long countByCycleId(UUID cycleId);
}
