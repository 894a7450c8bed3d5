package com.lms.backend.modules.activity.domain;

import java.time.Duration;
import java.util.Objects;

public record InactivityThreshold(Duration duration) {

    public InactivityThreshold {
        Objects.requireNonNull(duration, "duration is required");
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("inactivity threshold must be positive: " + duration);
        }
    }

    public static InactivityThreshold ofDays(long days) {
        return new InactivityThreshold(Duration.ofDays(days));
    }

    public long toDays() {
        return duration.toDays();
    }
}
