package com.lms.backend.modules.activity.application;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.lms.backend.modules.activity.domain.InactiveCandidate;
import com.lms.backend.modules.activity.domain.InactivityThreshold;
import com.lms.backend.modules.activity.domain.UserActivityRecord;

import org.springframework.stereotype.Component;

/**
 * Decides whether a user is inactive. Pure; role filtering is the caller's concern.
 */
@Component
public class ActivityClassifier {

    /**
     * @return a candidate when the user never engaged or has been idle for at least the threshold
     *         (the boundary counts as inactive), otherwise empty
     */
    public Optional<InactiveCandidate> classify(
            UserActivityRecord record,
            InactivityThreshold threshold,
            OffsetDateTime now
    ) {
        if (record.neverActive()) {
            return Optional.of(InactiveCandidate.neverActive(record));
        }

        Duration elapsed = Duration.between(record.lastActive(), now);
        if (elapsed.compareTo(threshold.duration()) >= 0) {
            return Optional.of(new InactiveCandidate(record, elapsed));
        }
        return Optional.empty();
    }

    public boolean hasFutureActivity(UserActivityRecord record, OffsetDateTime now) {
        return record.lastActive() != null && record.lastActive().isAfter(now);
    }
}
