package com.lms.backend.modules.notification.application;

import java.util.UUID;

import com.lms.backend.modules.activity.domain.InactiveCandidate;
import com.lms.backend.modules.notification.domain.DispatchOutcome;

/**
 * Write port for the LMS-side record of a delivered notice (in-app notification row and the user's
 * last-notified stamp).
 */
public interface NotificationSink {

    void recordDelivered(UUID cycleId, InactiveCandidate candidate, DispatchOutcome outcome);
}
