package com.lms.backend.modules.diagnostics.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.lms.backend.modules.diagnostics.domain.ActivityDiagnosis;
import com.lms.backend.modules.diagnostics.domain.ActivityDiagnosis.InactiveSample;
import com.lms.backend.modules.diagnostics.domain.ActivityDiagnosis.NotificationInfo;
import com.lms.backend.modules.diagnostics.domain.ActivityDiagnosis.RecentActivity;
import com.lms.backend.modules.diagnostics.domain.ActivityDiagnosis.Samples;
import com.lms.backend.modules.diagnostics.domain.ActivityDiagnosis.UserCounts;
import com.lms.backend.modules.notification.infrastructure.persistence.InAppNotificationRepository;
import com.lms.backend.modules.report.application.ReportArtifactWriter;
import com.lms.backend.modules.report.domain.ReportPaths;
import com.lms.backend.modules.user.domain.LmsUser;
import com.lms.backend.modules.user.infrastructure.persistence.LmsUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Explains the state of user activity data when a scan finds nobody to notify, and writes it out as an
 * activity report next to the scan reports.
 */
@Service
public class ActivityDiagnosticsService {

    private static final Logger log = LoggerFactory.getLogger(ActivityDiagnosticsService.class);

    public static final String FILE_PREFIX = "activity_report_";
    private static final int RECENT_NOTIFICATION_DAYS = 7;
    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "=".repeat(50);
    private static final String SUB_RULE = "-".repeat(20);

    private final LmsUserRepository lmsUserRepository;
    private final InAppNotificationRepository inAppNotificationRepository;
    private final ReportArtifactWriter artifactWriter;
    private final Clock clock;

    public ActivityDiagnosticsService(
            LmsUserRepository lmsUserRepository,
            InAppNotificationRepository inAppNotificationRepository,
            ReportArtifactWriter artifactWriter,
            Clock clock
    ) {
        this.lmsUserRepository = lmsUserRepository;
        this.inAppNotificationRepository = inAppNotificationRepository;
        this.artifactWriter = artifactWriter;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public DiagnosticsRun diagnose(int thresholdDays) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime cutoff = now.minusDays(thresholdDays);
        log.info("Running activity diagnosis (threshold {} days)", thresholdDays);

        UserCounts counts = new UserCounts(
                lmsUserRepository.count(),
                lmsUserRepository.countByAccountEnabled(true),
                lmsUserRepository.countByAccountEnabled(false),
                lmsUserRepository.countByLastActiveIsNull(),
                lmsUserRepository.countByAccountEnabledTrueAndLastActiveBefore(cutoff)
        );

        List<RecentActivity> recentActivity = lmsUserRepository.findTop10ByLastActiveIsNotNullOrderByLastActiveDesc()
                .stream()
                .map(user -> new RecentActivity(user.getId(), daysBetween(user.getLastActive(), now), user.isAccountEnabled()))
                .toList();

        List<InactiveSample> inactiveSamples = lmsUserRepository
                .findTop5ByAccountEnabledTrueAndLastActiveBeforeOrderByLastActiveAsc(cutoff)
                .stream()
                .map(user -> new InactiveSample(user.getId(), daysBetween(user.getLastActive(), now), hasEmail(user)))
                .toList();
        if (inactiveSamples.isEmpty()) {
            log.info("No inactive users found that meet notification criteria");
        } else {
            inactiveSamples.forEach(sample -> log.info("  User {}: email={}, inactive_days={}",
                    sample.userId(), sample.hasEmail(), sample.daysInactive()));
        }

        long recentNotifications = inAppNotificationRepository
                .countBySentAtGreaterThanEqual(now.minusDays(RECENT_NOTIFICATION_DAYS));

        ActivityDiagnosis diagnosis = new ActivityDiagnosis(
                now,
                counts,
                new NotificationInfo(recentNotifications, thresholdDays),
                new Samples(recentActivity, inactiveSamples),
                possibleIssues(counts, thresholdDays)
        );

        log.info("Activity diagnosis summary: total={} enabled={} missingLastActive={} potentialInactive={} recentNotifications={}",
                counts.totalUsers(), counts.enabledUsers(), counts.usersMissingLastActive(),
                counts.potentialInactiveUsers(), recentNotifications);

        ReportPaths paths = artifactWriter.write(
                FILE_PREFIX + ReportArtifactWriter.timestampKey(now),
                diagnosis,
                renderText(diagnosis)
        );
        log.info("Diagnosis complete. Reports saved to json={} text={}", paths.jsonPath(), paths.textPath());
        return new DiagnosticsRun(diagnosis, paths);
    }

    static List<String> possibleIssues(UserCounts counts, int thresholdDays) {
        List<String> issues = new ArrayList<>();
        if (counts.totalUsers() == 0) {
            issues.add("No users found in the database");
        }
        if (counts.usersMissingLastActive() > 0) {
            double percentage = counts.totalUsers() > 0
                    ? counts.usersMissingLastActive() * 100.0 / counts.totalUsers()
                    : 0;
            issues.add(String.format(Locale.ROOT, "%d users (%.1f%%) are missing last_active timestamps",
                    counts.usersMissingLastActive(), percentage));
        }
        if (counts.potentialInactiveUsers() == 0 && counts.totalUsers() > 0) {
            issues.add("No users meet the inactivity threshold of " + thresholdDays + " days");
        }
        return issues;
    }

    String renderText(ActivityDiagnosis diagnosis) {
        UserCounts counts = diagnosis.userCounts();
        StringBuilder text = new StringBuilder()
                .append("LMS Activity Diagnosis Report\n")
                .append("Generated: ")
                .append(diagnosis.generatedAt().withOffsetSameInstant(ZoneOffset.UTC).format(DISPLAY_FORMAT)).append('\n')
                .append(RULE).append("\n\n");

        text.append("USER STATISTICS\n").append(SUB_RULE).append('\n')
                .append("Total users: ").append(counts.totalUsers()).append('\n')
                .append("Enabled accounts: ").append(counts.enabledUsers()).append('\n')
                .append("Disabled accounts: ").append(counts.disabledUsers()).append('\n')
                .append("Users missing last_active: ").append(counts.usersMissingLastActive()).append('\n')
                .append("Potential inactive users: ").append(counts.potentialInactiveUsers()).append("\n\n");

        text.append("NOTIFICATION SETTINGS\n").append(SUB_RULE).append('\n')
                .append("Inactivity threshold: ").append(diagnosis.notificationInfo().thresholdDays()).append(" days\n")
                .append("Recent notifications (").append(RECENT_NOTIFICATION_DAYS).append(" days): ")
                .append(diagnosis.notificationInfo().recentNotifications()).append("\n\n");

        List<InactiveSample> inactive = diagnosis.samples().inactiveSamples();
        if (inactive.isEmpty()) {
            text.append("NO INACTIVE USERS FOUND\n").append(SUB_RULE).append('\n')
                    .append("No users meet the criteria for inactivity notification.\n");
        } else {
            text.append("SAMPLE INACTIVE USERS\n").append(SUB_RULE).append('\n');
            inactive.forEach(sample -> text.append("User ").append(sample.userId()).append(": ")
                    .append(sample.daysInactive()).append(" days inactive, has email: ")
                    .append(sample.hasEmail()).append('\n'));
        }

        List<RecentActivity> recent = diagnosis.samples().recentActivity();
        if (!recent.isEmpty()) {
            text.append("\nRECENT USER ACTIVITY\n").append(SUB_RULE).append('\n');
            recent.forEach(activity -> text.append("User ").append(activity.userId()).append(": ")
                    .append(activity.daysSinceActive()).append(" days since last active\n"));
        }

        text.append("\nPOSSIBLE ISSUES\n").append(SUB_RULE).append('\n');
        diagnosis.possibleIssues().forEach(issue -> text.append("- ").append(issue).append('\n'));
        return text.toString();
    }

    private static long daysBetween(OffsetDateTime from, OffsetDateTime to) {
        return Duration.between(from, to).toDays();
    }

    private static boolean hasEmail(LmsUser user) {
        return user.getEmail() != null && !user.getEmail().isBlank();
    }

    public record DiagnosticsRun(ActivityDiagnosis diagnosis, ReportPaths reportPaths) {
    }
}
