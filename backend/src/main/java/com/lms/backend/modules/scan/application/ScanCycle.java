package com.lms.backend.modules.scan.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import com.lms.backend.modules.activity.application.ActivityClassifier;
import com.lms.backend.modules.activity.application.StoreUnavailableException;
import com.lms.backend.modules.activity.application.UserActivityStore;
import com.lms.backend.modules.activity.domain.InactiveCandidate;
import com.lms.backend.modules.activity.domain.InactivityThreshold;
import com.lms.backend.modules.activity.domain.UserActivityRecord;
import com.lms.backend.modules.audit.application.DispatchAuditService;
import com.lms.backend.modules.notification.application.EmailDispatcher;
import com.lms.backend.modules.notification.application.NotificationSink;
import com.lms.backend.modules.notification.domain.DispatchOutcome;
import com.lms.backend.modules.report.application.ReportPersistException;
import com.lms.backend.modules.report.application.ScanReportGenerator;
import com.lms.backend.modules.report.domain.ReportPaths;
import com.lms.backend.modules.report.domain.ScanReport;
import com.lms.backend.modules.scan.domain.ScanCycleResult;
import com.lms.backend.modules.scan.domain.ScanCycleState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One pass of fetch, classify, dispatch and report. Instances are single-use and never shared between
 * cycles; only the dispatch step runs concurrently.
 */
final class ScanCycle {

    private static final Logger log = LoggerFactory.getLogger(ScanCycle.class);

    static final String REASON_SHUTDOWN = "not attempted: shutdown in progress";
    static final String REASON_AUDIT_LOST = "delivered but audit entry could not be recorded";
    private static final String ERROR_AUDIT_FAILED = "INACTIVITY_AUDIT_FAILED";

    private final UUID cycleId;
    private final InactivityThreshold threshold;
    private final OffsetDateTime now;
    private final Collaborators collaborators;
    private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());

    private ScanCycleState state = ScanCycleState.START;

    ScanCycle(UUID cycleId, InactivityThreshold threshold, OffsetDateTime now, Collaborators collaborators) {
        this.cycleId = cycleId;
        this.threshold = threshold;
        this.now = now;
        this.collaborators = collaborators;
    }

    ScanCycleResult run() {
        log.info("Inactivity scan {} started (threshold {} days, now {})", cycleId, threshold.toDays(), now);

        moveTo(ScanCycleState.FETCHING);
        List<UserActivityRecord> students;
        try {
            students = collaborators.store().fetchStudents();
        } catch (StoreUnavailableException ex) {
            moveTo(ScanCycleState.FAILED);
            log.error("[ALERT][Batch][INACTIVITY] cycle={} errorCode={} detail={}",
                    cycleId, ex.getCode(), ex.getDetailMessage(), ex);
            return ScanCycleResult.failed(cycleId, ex.getMessage());
        }

        moveTo(ScanCycleState.CLASSIFYING);
        List<InactiveCandidate> candidates = classify(students);
        log.info("Inactivity scan {}: {} students checked, {} inactive", cycleId, students.size(), candidates.size());

        moveTo(ScanCycleState.DISPATCHING);
        List<Dispatched> dispatched = dispatchAll(candidates);

        moveTo(ScanCycleState.REPORTING);
        List<DispatchOutcome> outcomes = dispatched.stream().map(Dispatched::outcome).toList();
        int neverActive = (int) dispatched.stream().filter(d -> d.candidate().isNeverActive()).count();
        OffsetDateTime finishedAt = latest(now, OffsetDateTime.now(collaborators.clock()));
        ScanReport report = collaborators.reportGenerator().summarize(
                cycleId, now, finishedAt, threshold, outcomes, neverActive, List.copyOf(warnings));

        ReportPaths paths = null;
        try {
            paths = collaborators.reportGenerator().persist(report);
            log.info("Inactivity scan {} report saved to {}", cycleId, paths.textPath());
        } catch (ReportPersistException ex) {
            log.warn("[ALERT][Batch][INACTIVITY] cycle={} errorCode={} detail={}",
                    cycleId, ex.getCode(), ex.getDetailMessage());
        }

        moveTo(ScanCycleState.DONE);
        log.info("Inactivity scan {} finished: candidates={} sent={} failed={} warnings={}",
                cycleId, report.totalCandidates(), report.sentCount(), report.failedCount(), report.warnings().size());
        return ScanCycleResult.completed(cycleId, report, paths);
    }

    ScanCycleState state() {
        return state;
    }

    private List<InactiveCandidate> classify(List<UserActivityRecord> students) {
        Map<Long, UserActivityRecord> unique = new LinkedHashMap<>();
        for (UserActivityRecord student : students) {
            if (unique.putIfAbsent(student.userId(), student) != null) {
                warn("duplicate user " + student.userId() + " in fetched records; notified at most once");
            }
        }

        ActivityClassifier classifier = collaborators.classifier();
        List<InactiveCandidate> candidates = new ArrayList<>();
        for (UserActivityRecord student : unique.values()) {
            if (classifier.hasFutureActivity(student, now)) {
                warn("user " + student.userId() + " has last activity in the future (" + student.lastActive() + ")");
            }
            classifier.classify(student, threshold, now).ifPresent(candidates::add);
        }
        return candidates;
    }

    private List<Dispatched> dispatchAll(List<InactiveCandidate> candidates) {
        List<CompletableFuture<Optional<Dispatched>>> tasks = new ArrayList<>(candidates.size());
        for (InactiveCandidate candidate : candidates) {
            CompletableFuture<Optional<Dispatched>> task;
            try {
                task = CompletableFuture.supplyAsync(() -> dispatchOne(candidate), collaborators.executor());
            } catch (RejectedExecutionException ex) {
                task = CompletableFuture.completedFuture(Optional.of(notAttempted(candidate)));
            }
            tasks.add(task.exceptionally(ex -> Optional.of(unexpected(candidate, ex))));
        }
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0])).join();

        List<Dispatched> dispatched = new ArrayList<>(tasks.size());
        tasks.forEach(task -> task.join().ifPresent(dispatched::add));
        return dispatched;
    }

    private Optional<Dispatched> dispatchOne(InactiveCandidate candidate) {
        if (collaborators.shutdownGuard().isShuttingDown()) {
            return Optional.of(notAttempted(candidate));
        }
        if (alreadySent(candidate)) {
            warn("user " + candidate.userId() + " already notified in this cycle; skipped");
            return Optional.empty();
        }

        DispatchOutcome outcome = audit(collaborators.dispatcher().dispatch(candidate));
        if (outcome.isSent()) {
            try {
                collaborators.sink().recordDelivered(cycleId, candidate, outcome);
            } catch (RuntimeException ex) {
                warn("in-app notification for user " + candidate.userId() + " could not be recorded: " + ex.getMessage());
            }
        }
        return Optional.of(new Dispatched(candidate, outcome));
    }

    private boolean alreadySent(InactiveCandidate candidate) {
        try {
            return collaborators.auditService().alreadySent(cycleId, candidate.userId());
        } catch (RuntimeException ex) {
            warn("could not check earlier sends for user " + candidate.userId() + ": " + ex.getMessage());
            return false;
        }
    }

    private Dispatched notAttempted(InactiveCandidate candidate) {
        DispatchOutcome outcome = DispatchOutcome.failed(candidate.userId(), candidate.user().email(),
                OffsetDateTime.now(collaborators.clock()), REASON_SHUTDOWN);
        return new Dispatched(candidate, audit(outcome));
    }

    private Dispatched unexpected(InactiveCandidate candidate, Throwable ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        log.error("[ALERT][Batch][INACTIVITY] cycle={} user={} errorCode={} detail={}",
                cycleId, candidate.userId(), "INACTIVITY_DISPATCH_FAILED", cause.getMessage(), cause);
        DispatchOutcome outcome = DispatchOutcome.failed(candidate.userId(), candidate.user().email(),
                OffsetDateTime.now(collaborators.clock()), "unexpected error: " + cause.getClass().getSimpleName());
        warn("dispatch to user " + candidate.userId() + " failed unexpectedly: " + cause.getClass().getSimpleName());
        return new Dispatched(candidate, audit(outcome));
    }

    /**
     * Appends the audit entry. A delivered notice that cannot be audited is reported as failed.
     */
    private DispatchOutcome audit(DispatchOutcome outcome) {
        try {
            collaborators.auditService().record(cycleId, outcome);
            return outcome;
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Batch][INACTIVITY] cycle={} user={} errorCode={} detail={}",
                    cycleId, outcome.recipientId(), ERROR_AUDIT_FAILED, ex.getMessage());
            warn("audit entry for user " + outcome.recipientId() + " could not be recorded: " + ex.getMessage());
            return outcome.isSent() ? outcome.downgrade(REASON_AUDIT_LOST) : outcome;
        }
    }

    private void warn(String warning) {
        log.warn("Inactivity scan {}: {}", cycleId, warning);
        warnings.add(warning);
    }

    private void moveTo(ScanCycleState next) {
        log.debug("Inactivity scan {}: {} -> {}", cycleId, state, next);
        state = state.transitionTo(next);
    }

    private static OffsetDateTime latest(OffsetDateTime a, OffsetDateTime b) {
        return a.isAfter(b) ? a : b;
    }

    private record Dispatched(InactiveCandidate candidate, DispatchOutcome outcome) {
    }

    record Collaborators(
            UserActivityStore store,
            ActivityClassifier classifier,
            EmailDispatcher dispatcher,
            DispatchAuditService auditService,
            NotificationSink sink,
            ScanReportGenerator reportGenerator,
            DispatchShutdownGuard shutdownGuard,
            Executor executor,
            Clock clock
    ) {
    }
}
