package com.lms.backend.modules.scan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.lms.backend.modules.activity.domain.InactivityThreshold;
import com.lms.backend.modules.diagnostics.application.ActivityDiagnosticsService;
import com.lms.backend.modules.report.application.ReportPersistException;
import com.lms.backend.modules.report.domain.ScanReport;
import com.lms.backend.modules.scan.application.InactivityScanJob;
import com.lms.backend.modules.scan.application.InactivityScanService;
import com.lms.backend.modules.scan.domain.ScanCycleResult;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.CannotCreateTransactionException;

@ExtendWith(MockitoExtension.class)
class InactivityScanJobTest {

    private static final UUID CYCLE_ID = UUID.fromString("00000000-0000-4000-8000-000000000077");
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2024-06-01T08:00:00Z");

    @Mock
    private InactivityScanService scanService;

    @Mock
    private ActivityDiagnosticsService diagnosticsService;

    @Test
    @DisplayName("a cycle that sent nothing is followed by a diagnosis")
    void execute_diagnosesWhenNothingSent() {
        when(scanService.runCycle()).thenReturn(completed(0));
        when(scanService.configuredThreshold()).thenReturn(InactivityThreshold.ofDays(14));

        new InactivityScanJob(scanService, diagnosticsService, false).execute();

        verify(diagnosticsService).diagnose(14);
    }

    @Test
    void execute_skipsDiagnosisAfterSuccessfulSends() {
        when(scanService.runCycle()).thenReturn(completed(2));

        new InactivityScanJob(scanService, diagnosticsService, false).execute();

        verify(diagnosticsService, never()).diagnose(anyInt());
    }

    @Test
    void execute_alwaysDiagnosesWhenEnabled() {
        when(scanService.runCycle()).thenReturn(completed(2));
        when(scanService.configuredThreshold()).thenReturn(InactivityThreshold.ofDays(14));

        new InactivityScanJob(scanService, diagnosticsService, true).execute();

        verify(diagnosticsService).diagnose(14);
    }

    @Test
    @DisplayName("a failing diagnosis never changes the cycle result")
    void execute_diagnosisFailureIsContained() {
        ScanCycleResult cycle = completed(0);
        when(scanService.runCycle()).thenReturn(cycle);
        when(scanService.configuredThreshold()).thenReturn(InactivityThreshold.ofDays(14));
        when(diagnosticsService.diagnose(14)).thenThrow(new ReportPersistException("disk full", null));

        assertThat(new InactivityScanJob(scanService, diagnosticsService, false).execute()).isSameAs(cycle);
    }

    @Test
    void execute_unreachableDatabaseDuringDiagnosisIsContained() {
        ScanCycleResult cycle = completed(0);
        when(scanService.runCycle()).thenReturn(cycle);
        when(scanService.configuredThreshold()).thenReturn(InactivityThreshold.ofDays(14));
        when(diagnosticsService.diagnose(14))
                .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager for transaction"));

        assertThat(new InactivityScanJob(scanService, diagnosticsService, false).execute()).isSameAs(cycle);
    }

    @Test
    void execute_failedCycleIsNotDiagnosed() {
        when(scanService.runCycle()).thenReturn(ScanCycleResult.failed(CYCLE_ID, "STORE_UNAVAILABLE: down"));

        ScanCycleResult result = new InactivityScanJob(scanService, diagnosticsService, true).execute();

        assertThat(result.isFailed()).isTrue();
        verify(diagnosticsService, never()).diagnose(anyInt());
    }

    private static ScanCycleResult completed(int sent) {
        ScanReport report = new ScanReport(CYCLE_ID, NOW, NOW, 14, sent, sent, 0, 0, List.of(), List.of());
        return ScanCycleResult.completed(CYCLE_ID, report, null);
    }
}
