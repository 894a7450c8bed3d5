package com.lms.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.lms.backend.modules.activity.domain.InactiveCandidate;
import com.lms.backend.modules.notification.application.MailTransport.TransportResult;
import com.lms.backend.modules.notification.domain.DispatchOutcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends the inactivity notice to one candidate. Every failure is turned into a {@code FAILED} outcome so a
 * bad recipient never aborts the batch; nothing is retried within a cycle.
 */
@Component
public class EmailDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EmailDispatcher.class);
    private static final String ERROR_TRANSPORT_FAILED = "INACTIVITY_MAIL_FAILED";
    private static final String ERROR_NO_EMAIL = "INACTIVITY_NO_EMAIL";
    private static final String REASON_NO_EMAIL = "no email address on file";

    private final MailTransport mailTransport;
    private final InactivityMessageTemplate messageTemplate;
    private final Clock clock;

    public EmailDispatcher(MailTransport mailTransport, InactivityMessageTemplate messageTemplate, Clock clock) {
        this.mailTransport = mailTransport;
        this.messageTemplate = messageTemplate;
        this.clock = clock;
    }

    public DispatchOutcome dispatch(InactiveCandidate candidate) {
        long userId = candidate.userId();
        String email = candidate.user().email();
        OffsetDateTime attemptedAt = OffsetDateTime.now(clock);

        if (!candidate.user().hasEmail()) {
            log.warn("[ALERT][Batch][INACTIVITY] attempt={} user={} errorCode={} detail={}",
                    1, userId, ERROR_NO_EMAIL, REASON_NO_EMAIL);
            return DispatchOutcome.failed(userId, email, attemptedAt, REASON_NO_EMAIL);
        }

        TransportResult result;
        try {
            result = mailTransport.send(email, messageTemplate.subject(), messageTemplate.body(candidate));
        } catch (RuntimeException ex) {
            result = TransportResult.failure(ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }

        if (result.delivered()) {
            log.info("Sent inactivity notice to user {} ({} days inactive)", userId,
                    candidate.isNeverActive() ? "never active" : candidate.daysInactive());
            return DispatchOutcome.sent(userId, email, attemptedAt);
        }

        log.warn("[ALERT][Batch][INACTIVITY] attempt={} user={} errorCode={} detail={}",
                1, userId, ERROR_TRANSPORT_FAILED, result.reason());
        return DispatchOutcome.failed(userId, email, attemptedAt, result.reason());
    }
}
