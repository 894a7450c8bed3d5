package com.lms.backend.modules.notification.domain;

public enum DispatchStatus {
    SENT,
    FAILED
}
