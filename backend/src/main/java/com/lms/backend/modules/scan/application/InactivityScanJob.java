package com.lms.backend.modules.scan.application;

import com.lms.backend.global.error.MonitorException;
import com.lms.backend.modules.diagnostics.application.ActivityDiagnosticsService;
import com.lms.backend.modules.scan.domain.ScanCycleResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * A scan cycle followed, when nothing was sent or diagnostics are switched on, by an activity diagnosis.
 * Shared by the scheduled trigger and the {@code run} command.
 */
@Service
public class InactivityScanJob {

    private static final Logger log = LoggerFactory.getLogger(InactivityScanJob.class);

    private final InactivityScanService scanService;
    private final ActivityDiagnosticsService diagnosticsService;
    private final boolean diagnosticsAlways;

    public InactivityScanJob(
            InactivityScanService scanService,
            ActivityDiagnosticsService diagnosticsService,
            @Value("${lms.diagnostics.enabled:false}") boolean diagnosticsAlways
    ) {
        this.scanService = scanService;
        this.diagnosticsService = diagnosticsService;
        this.diagnosticsAlways = diagnosticsAlways;
    }

    public ScanCycleResult execute() {
        ScanCycleResult result = scanService.runCycle();
        if (result.isFailed()) {
            log.error("[ALERT][Batch][INACTIVITY] cycle={} errorCode=SCAN_CYCLE_FAILED detail={}",
                    result.cycleId(), result.failureReason().orElse("unknown"));
            return result;
        }

        if (diagnosticsAlways || result.sentCount() == 0) {
            if (result.sentCount() == 0) {
                log.info("No inactivity notices sent in cycle {}; running activity diagnosis", result.cycleId());
            }
            try {
                diagnosticsService.diagnose((int) scanService.configuredThreshold().toDays());
            } catch (MonitorException | DataAccessException | TransactionException ex) {
                log.warn("[ALERT][Batch][DIAGNOSTICS] cycle={} errorCode=DIAGNOSTICS_FAILED detail={}",
                        result.cycleId(), ex.getMessage(), ex);
            }
        }
        return result;
    }
}
