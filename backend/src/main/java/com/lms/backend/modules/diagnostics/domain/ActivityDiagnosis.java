package com.lms.backend.modules.diagnostics.domain;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Snapshot explaining why the monitor did or did not find inactive users.
 */
public record ActivityDiagnosis(
        OffsetDateTime generatedAt,
        UserCounts userCounts,
        NotificationInfo notificationInfo,
        Samples samples,
        List<String> possibleIssues
) {

    public record UserCounts(
            long totalUsers,
            long enabledUsers,
            long disabledUsers,
            long usersMissingLastActive,
            long potentialInactiveUsers
    ) {
    }

    public record NotificationInfo(long recentNotifications, int thresholdDays) {
    }

    public record Samples(List<RecentActivity> recentActivity, List<InactiveSample> inactiveSamples) {
    }

    public record RecentActivity(long userId, long daysSinceActive, boolean accountEnabled) {
    }

    public record InactiveSample(long userId, long daysInactive, boolean hasEmail) {
    }
}
