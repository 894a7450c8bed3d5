package com.lms.backend.modules.activity.domain;

import java.time.OffsetDateTime;
import java.util.Objects;

import com.lms.backend.modules.user.domain.UserRole;

/**
 * Read-only activity snapshot of one user. {@code lastActive} is null for users who never engaged;
 * {@code email} may be blank when the account has no address on file.
 */
public record UserActivityRecord(
        long userId,
        String email,
        String displayName,
        UserRole role,
        OffsetDateTime lastActive
) {

    public UserActivityRecord {
        Objects.requireNonNull(role, "role is required");
        displayName = displayName == null || displayName.isBlank() ? "student" : displayName.trim();
        email = email == null ? "" : email.trim();
    }

    public boolean hasEmail() {
        return !email.isEmpty();
    }

    public boolean neverActive() {
        return lastActive == null;
    }
}
