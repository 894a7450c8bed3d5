package com.lms.backend.modules.notification.infrastructure.persistence;

import java.time.format.DateTimeFormatter;
import java.util.UUID;

import com.lms.backend.modules.activity.domain.InactiveCandidate;
import com.lms.backend.modules.notification.application.NotificationSink;
import com.lms.backend.modules.notification.domain.DispatchOutcome;
import com.lms.backend.modules.notification.domain.InAppNotification;
import com.lms.backend.modules.user.infrastructure.persistence.LmsUserRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaNotificationSink implements NotificationSink {

    public static final String KIND_INACTIVITY = "INACTIVITY_REMINDER";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final InAppNotificationRepository inAppNotificationRepository;
    private final LmsUserRepository lmsUserRepository;

    public JpaNotificationSink(
            InAppNotificationRepository inAppNotificationRepository,
            LmsUserRepository lmsUserRepository
    ) {
        this.inAppNotificationRepository = inAppNotificationRepository;
        this.lmsUserRepository = lmsUserRepository;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordDelivered(UUID cycleId, InactiveCandidate candidate, DispatchOutcome outcome) {
        InAppNotification notification = new InAppNotification();
        notification.setUser(lmsUserRepository.getReferenceById(candidate.userId()));
        notification.setKindCode(KIND_INACTIVITY);
        notification.setMessage("Inactivity notification sent on " + outcome.attemptedAt().format(DATE_FORMAT));
        notification.setCorrelationId(cycleId);
        notification.setSentAt(outcome.attemptedAt());
        inAppNotificationRepository.save(notification);

        lmsUserRepository.markNotified(candidate.userId(), outcome.attemptedAt());
    }
}
