package com.lms.backend.modules.user.domain;

public enum UserRole {
    STUDENT,
    INSTRUCTOR,
    ADMIN;

    public boolean receivesInactivityNotices() {
        return this == STUDENT;
    }
}
