package com.lms.backend.modules.activity.domain;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A user classified inactive within one scan cycle, with the inactivity measured at classification time.
 */
public record InactiveCandidate(UserActivityRecord user, Duration inactiveFor) {

    /** Elapsed inactivity of a user who was never active. */
    public static final Duration NEVER_ACTIVE = ChronoUnit.FOREVER.getDuration();

    public InactiveCandidate {
        Objects.requireNonNull(user, "user is required");
        Objects.requireNonNull(inactiveFor, "inactiveFor is required");
    }

    public static InactiveCandidate neverActive(UserActivityRecord user) {
        return new InactiveCandidate(user, NEVER_ACTIVE);
    }

    public boolean isNeverActive() {
        return NEVER_ACTIVE.equals(inactiveFor);
    }

    /**
     * Whole days inactive, or -1 for a user who was never active.
     */
    public long daysInactive() {
        return isNeverActive() ? -1 : inactiveFor.toDays();
    }

    public long userId() {
        return user.userId();
    }
}
