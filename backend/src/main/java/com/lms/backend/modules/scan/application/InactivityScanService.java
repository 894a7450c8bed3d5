package com.lms.backend.modules.scan.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;

import com.lms.backend.global.config.SchedulingConfig;
import com.lms.backend.modules.activity.application.ActivityClassifier;
import com.lms.backend.modules.activity.application.UserActivityStore;
import com.lms.backend.modules.activity.domain.InactivityThreshold;
import com.lms.backend.modules.audit.application.DispatchAuditService;
import com.lms.backend.modules.notification.application.EmailDispatcher;
import com.lms.backend.modules.notification.application.NotificationSink;
import com.lms.backend.modules.report.application.ScanReportGenerator;
import com.lms.backend.modules.scan.domain.ScanCycleResult;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Entry point for inactivity scans. Each call runs a fresh cycle with its own id; cycles share no state.
 */
@Service
public class InactivityScanService {

    private final ScanCycle.Collaborators collaborators;
    private final InactivityThreshold configuredThreshold;

    public InactivityScanService(
            UserActivityStore store,
            ActivityClassifier classifier,
            EmailDispatcher dispatcher,
            DispatchAuditService auditService,
            NotificationSink sink,
            ScanReportGenerator reportGenerator,
            DispatchShutdownGuard shutdownGuard,
            @Qualifier(SchedulingConfig.DISPATCH_EXECUTOR) Executor dispatchExecutor,
            Clock clock,
            @Value("${lms.inactivity.threshold-days:14}") long thresholdDays
    ) {
        this.collaborators = new ScanCycle.Collaborators(
                store,
                classifier,
                dispatcher,
                auditService,
                sink,
                reportGenerator,
                shutdownGuard,
                dispatchExecutor,
                clock
        );
        this.configuredThreshold = InactivityThreshold.ofDays(thresholdDays);
    }

    public ScanCycleResult runCycle(InactivityThreshold threshold, OffsetDateTime now) {
        Objects.requireNonNull(threshold, "threshold is required");
        Objects.requireNonNull(now, "now is required");
        return new ScanCycle(UUID.randomUUID(), threshold, now, collaborators).run();
    }

    /**
     * Runs a cycle with the configured threshold at the current time.
     */
    public ScanCycleResult runCycle() {
        return runCycle(configuredThreshold, OffsetDateTime.now(collaborators.clock()));
    }

    public InactivityThreshold configuredThreshold() {
        return configuredThreshold;
    }
}
