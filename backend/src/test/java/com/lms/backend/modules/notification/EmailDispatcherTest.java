package com.lms.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.lms.backend.modules.activity.domain.InactiveCandidate;
import com.lms.backend.modules.activity.domain.UserActivityRecord;
import com.lms.backend.modules.notification.application.EmailDispatcher;
import com.lms.backend.modules.notification.application.InactivityMessageTemplate;
import com.lms.backend.modules.notification.application.MailTransport;
import com.lms.backend.modules.notification.application.MailTransport.TransportResult;
import com.lms.backend.modules.notification.domain.DispatchOutcome;
import com.lms.backend.modules.notification.domain.DispatchStatus;
import com.lms.backend.modules.user.domain.UserRole;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@ExtendWith({MockitoExtension.class, OutputCaptureExtension.class})
class EmailDispatcherTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2024-06-01T08:00:00Z");
    private static final String SUBJECT = "We miss you in your online courses!";

    @Mock
    private MailTransport mailTransport;

    private EmailDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        dispatcher = new EmailDispatcher(mailTransport, new InactivityMessageTemplate(SUBJECT), clock);
    }

    @Test
    @DisplayName("a delivered message yields a SENT outcome stamped with the attempt time")
    void dispatch_delivered() {
        InactiveCandidate candidate = idleCandidate(1L, "ana@example.com");
        when(mailTransport.send(eq("ana@example.com"), eq(SUBJECT), contains("for 45 days")))
                .thenReturn(TransportResult.success());

        DispatchOutcome outcome = dispatcher.dispatch(candidate);

        assertThat(outcome.status()).isEqualTo(DispatchStatus.SENT);
        assertThat(outcome.recipientId()).isEqualTo(1L);
        assertThat(outcome.recipientEmail()).isEqualTo("ana@example.com");
        assertThat(outcome.attemptedAt()).isEqualTo(NOW);
        assertThat(outcome.failureReason()).isNull();
    }

    @Test
    @DisplayName("a transport rejection becomes a FAILED outcome carrying the transport reason")
    void dispatch_rejected() {
        when(mailTransport.send(anyString(), anyString(), anyString()))
                .thenReturn(TransportResult.failure("MailSendException: 550 mailbox unavailable"));

        DispatchOutcome outcome = dispatcher.dispatch(idleCandidate(2L, "bo@example.com"));

        assertThat(outcome.status()).isEqualTo(DispatchStatus.FAILED);
        assertThat(outcome.failureReason()).isEqualTo("MailSendException: 550 mailbox unavailable");
    }

    @Test
    @DisplayName("an exception thrown by the transport does not escape the dispatcher")
    void dispatch_transportThrows() {
        when(mailTransport.send(anyString(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("connection reset"));

        DispatchOutcome outcome = dispatcher.dispatch(idleCandidate(3L, "cy@example.com"));

        assertThat(outcome.status()).isEqualTo(DispatchStatus.FAILED);
        assertThat(outcome.failureReason()).contains("connection reset");
    }

    @Test
    @DisplayName("a candidate without an email address fails without touching the transport")
    void dispatch_noEmail() {
        DispatchOutcome outcome = dispatcher.dispatch(idleCandidate(4L, null));

        assertThat(outcome.status()).isEqualTo(DispatchStatus.FAILED);
        assertThat(outcome.failureReason()).isEqualTo("no email address on file");
        verify(mailTransport, never()).send(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("missing addresses and transport failures raise alerts of the same shape")
    void dispatch_alertLinesShareShape(CapturedOutput output) {
        when(mailTransport.send(anyString(), anyString(), anyString()))
                .thenReturn(TransportResult.failure("550 mailbox unavailable"));

        dispatcher.dispatch(idleCandidate(6L, null));
        dispatcher.dispatch(idleCandidate(7L, "ed@example.com"));

        assertThat(output.getOut())
                .contains("[ALERT][Batch][INACTIVITY] attempt=1 user=6 errorCode=INACTIVITY_NO_EMAIL detail=no email address on file")
                .contains("[ALERT][Batch][INACTIVITY] attempt=1 user=7 errorCode=INACTIVITY_MAIL_FAILED detail=550 mailbox unavailable");
    }

    @Test
    @DisplayName("never-active candidates receive the welcome wording")
    void dispatch_neverActiveTemplate() {
        UserActivityRecord record = new UserActivityRecord(5L, "di@example.com", "Di", UserRole.STUDENT, null);
        when(mailTransport.send(eq("di@example.com"), eq(SUBJECT), contains("haven't seen you in any of your courses yet")))
                .thenReturn(TransportResult.success());

        DispatchOutcome outcome = dispatcher.dispatch(InactiveCandidate.neverActive(record));

        assertThat(outcome.isSent()).isTrue();
    }

    private static InactiveCandidate idleCandidate(long id, String email) {
        UserActivityRecord record = new UserActivityRecord(id, email, "User " + id, UserRole.STUDENT, NOW.minusDays(45));
        return new InactiveCandidate(record, Duration.ofDays(45));
    }
}
