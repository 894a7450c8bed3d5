package com.lms.backend.modules.scan.presentation;

import java.io.PrintStream;
import java.util.List;

import com.lms.backend.global.error.MonitorException;
import com.lms.backend.modules.diagnostics.application.ActivityDiagnosticsService;
import com.lms.backend.modules.diagnostics.application.ActivityDiagnosticsService.DiagnosticsRun;
import com.lms.backend.modules.report.application.ReportCatalog;
import com.lms.backend.modules.report.application.ReportCatalog.ReportListing;
import com.lms.backend.modules.scan.application.InactivityScanJob;
import com.lms.backend.modules.scan.application.InactivityScanService;
import com.lms.backend.modules.scan.domain.ScanCycleResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * One-shot commands: {@code run}, {@code diagnose}, {@code reports} and {@code report <n>}. Without a
 * command nothing happens here and the scheduler drives the daemon.
 */
@Component
public class InactivityCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(InactivityCommandRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    private static final String USAGE = "usage: run | diagnose | reports | report <number>";

    private final InactivityScanJob scanJob;
    private final InactivityScanService scanService;
    private final ActivityDiagnosticsService diagnosticsService;
    private final ReportCatalog reportCatalog;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    @Autowired
    public InactivityCommandRunner(
            InactivityScanJob scanJob,
            InactivityScanService scanService,
            ActivityDiagnosticsService diagnosticsService,
            ReportCatalog reportCatalog
    ) {
        this(scanJob, scanService, diagnosticsService, reportCatalog, System.out);
    }

    InactivityCommandRunner(
            InactivityScanJob scanJob,
            InactivityScanService scanService,
            ActivityDiagnosticsService diagnosticsService,
            ReportCatalog reportCatalog,
            PrintStream out
    ) {
        this.scanJob = scanJob;
        this.scanService = scanService;
        this.diagnosticsService = diagnosticsService;
        this.reportCatalog = reportCatalog;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> command = args.getNonOptionArgs();
        if (command.isEmpty()) {
            return;
        }
        exitCode = execute(command);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(List<String> command) {
        String name = command.get(0);
        try {
            switch (name) {
                case "run":
                    return runCycle();
                case "diagnose":
                    return diagnose();
                case "reports":
                    return listReports();
                case "report":
                    return showReport(command);
                default:
                    out.println("Unknown command: " + name);
                    out.println(USAGE);
                    return EXIT_FAILURE;
            }
        } catch (MonitorException ex) {
            log.error("Command '{}' failed: code={} detail={}", name, ex.getCode(), ex.getDetailMessage());
            out.println("Error: " + ex.getDetailMessage());
            return EXIT_FAILURE;
        } catch (DataAccessException | TransactionException ex) {
            log.error("Command '{}' failed: database unavailable", name, ex);
            out.println("Error: database unavailable: " + ex.getMostSpecificCause().getMessage());
            return EXIT_FAILURE;
        }
    }

    private int runCycle() {
        ScanCycleResult result = scanJob.execute();
        if (result.isFailed()) {
            out.println("Scan cycle " + result.cycleId() + " failed: " + result.failureReason().orElse("unknown"));
            return EXIT_FAILURE;
        }
        result.report().ifPresent(report -> out.println("Scan cycle " + result.cycleId() + " done: "
                + report.totalCandidates() + " inactive, " + report.sentCount() + " sent, "
                + report.failedCount() + " failed"));
        result.reportPaths().ifPresent(paths -> out.println("Report: " + paths.textPath()));
        return EXIT_OK;
    }

    private int diagnose() {
        DiagnosticsRun run = diagnosticsService.diagnose((int) scanService.configuredThreshold().toDays());
        out.println("Diagnosis saved to " + run.reportPaths().textPath());
        run.diagnosis().possibleIssues().forEach(issue -> out.println("- " + issue));
        return EXIT_OK;
    }

    private int listReports() {
        List<ReportListing> reports = reportCatalog.listReports();
        if (reports.isEmpty()) {
            out.println("No reports found.");
            return EXIT_OK;
        }
        out.println("Available reports:");
        reports.forEach(listing -> out.println(listing.number() + ". " + listing.displayTimestamp()
                + " - " + listing.fileName()));
        return EXIT_OK;
    }

    private int showReport(List<String> command) {
        if (command.size() < 2) {
            out.println(USAGE);
            return EXIT_FAILURE;
        }
        int number;
        try {
            number = Integer.parseInt(command.get(1).trim());
        } catch (NumberFormatException ex) {
            out.println("Invalid report number: " + command.get(1));
            return EXIT_FAILURE;
        }
        out.println(reportCatalog.readReport(number));
        return EXIT_OK;
    }
}
