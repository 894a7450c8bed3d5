package com.lms.backend.modules.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.lms.backend.modules.audit.application.AuditReadException;
import com.lms.backend.modules.audit.application.AuditWriteException;
import com.lms.backend.modules.audit.application.DispatchAuditService;
import com.lms.backend.modules.audit.domain.DispatchAuditEntry;
import com.lms.backend.modules.audit.infrastructure.DispatchAuditEntryRepository;
import com.lms.backend.modules.notification.domain.DispatchOutcome;
import com.lms.backend.modules.notification.domain.DispatchStatus;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class DispatchAuditServiceTest {

    private static final UUID CYCLE_ID = UUID.fromString("6f1c2a9e-0000-4000-8000-000000000001");
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2024-06-01T08:00:00Z");

    @Mock
    private DispatchAuditEntryRepository repository;

    private DispatchAuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new DispatchAuditService(repository, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("an outcome is appended with the cycle id and the recording time")
    void record_appendsEntry() {
        DispatchOutcome outcome = DispatchOutcome.failed(7L, "ana@example.com", NOW.minusSeconds(5), "550 rejected");

        auditService.record(CYCLE_ID, outcome);

        ArgumentCaptor<DispatchAuditEntry> captor = ArgumentCaptor.forClass(DispatchAuditEntry.class);
        verify(repository).saveAndFlush(captor.capture());
        DispatchAuditEntry entry = captor.getValue();
        assertThat(entry.getCycleId()).isEqualTo(CYCLE_ID);
        assertThat(entry.getRecipientId()).isEqualTo(7L);
        assertThat(entry.getRecipientEmail()).isEqualTo("ana@example.com");
        assertThat(entry.getAttemptedAt()).isEqualTo(NOW.minusSeconds(5));
        assertThat(entry.getStatus()).isEqualTo(DispatchStatus.FAILED);
        assertThat(entry.getReason()).isEqualTo("550 rejected");
        assertThat(entry.getRecordedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("a storage failure while appending surfaces as an audit write failure")
    void record_storageFailure() {
        when(repository.saveAndFlush(any(DispatchAuditEntry.class)))
                .thenThrow(new DataAccessResourceFailureException("disk full"));

        assertThatThrownBy(() -> auditService.record(CYCLE_ID, DispatchOutcome.sent(7L, "ana@example.com", NOW)))
                .isInstanceOf(AuditWriteException.class)
                .hasMessageContaining("AUDIT_WRITE_FAILED")
                .hasMessageContaining("disk full");
    }

    @Test
    @DisplayName("a read failure is an error, never an empty history")
    void recent_storageFailure() {
        when(repository.findByCycleIdOrderByAttemptedAtAscIdAsc(CYCLE_ID))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> auditService.recent(CYCLE_ID))
                .isInstanceOf(AuditReadException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    void recent_returnsEntriesInRepositoryOrder() {
        DispatchAuditEntry first = DispatchAuditEntry.of(CYCLE_ID, DispatchOutcome.sent(1L, "a@example.com", NOW), NOW);
        DispatchAuditEntry second = DispatchAuditEntry.of(CYCLE_ID, DispatchOutcome.sent(2L, "b@example.com", NOW), NOW);
        when(repository.findByCycleIdOrderByAttemptedAtAscIdAsc(CYCLE_ID)).thenReturn(List.of(first, second));

        assertThat(auditService.recent(CYCLE_ID)).containsExactly(first, second);
    }

    @Test
    void alreadySent_checksSentEntriesOfTheCycle() {
        when(repository.existsByCycleIdAndRecipientIdAndStatus(CYCLE_ID, 3L, DispatchStatus.SENT)).thenReturn(true);

        assertThat(auditService.alreadySent(CYCLE_ID, 3L)).isTrue();
    }
}
