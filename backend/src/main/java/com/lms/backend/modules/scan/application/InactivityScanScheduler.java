package com.lms.backend.modules.scan.application;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "lms.inactivity.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class InactivityScanScheduler {

    private final InactivityScanJob scanJob;

    public InactivityScanScheduler(InactivityScanJob scanJob) {
        this.scanJob = scanJob;
    }

    @Scheduled(cron = "${lms.inactivity.cron:0 0 8 * * *}", zone = "UTC")
    public void runDailyScan() {
        scanJob.execute();
    }
}
