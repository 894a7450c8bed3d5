package com.lms.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.OffsetDateTime;

import com.lms.backend.modules.activity.domain.InactiveCandidate;
import com.lms.backend.modules.activity.domain.UserActivityRecord;
import com.lms.backend.modules.notification.application.InactivityMessageTemplate;
import com.lms.backend.modules.user.domain.UserRole;

import org.junit.jupiter.api.Test;

class InactivityMessageTemplateTest {

    private final InactivityMessageTemplate template = new InactivityMessageTemplate("subject");

    @Test
    void idleBodyMentionsDaysAndLastActivityDate() {
        UserActivityRecord record = new UserActivityRecord(1L, "ana@example.com", "Ana", UserRole.STUDENT,
                OffsetDateTime.parse("2024-04-01T10:15:00Z"));

        String body = template.body(new InactiveCandidate(record, Duration.ofDays(61)));

        assertThat(body)
                .startsWith("Hello Ana,")
                .contains("for 61 days.")
                .contains("Your last activity was on 2024-04-01.")
                .endsWith("Best regards,\nThe LMS Team\n");
    }

    @Test
    void singleDayIsNotPluralised() {
        UserActivityRecord record = new UserActivityRecord(1L, "ana@example.com", "Ana", UserRole.STUDENT,
                OffsetDateTime.parse("2024-05-31T00:00:00Z"));

        assertThat(template.body(new InactiveCandidate(record, Duration.ofDays(1)))).contains("for 1 day.");
    }

    @Test
    void neverActiveBodyHasNoLastActivityLine() {
        UserActivityRecord record = new UserActivityRecord(2L, "bo@example.com", null, UserRole.STUDENT, null);

        String body = template.body(InactiveCandidate.neverActive(record));

        assertThat(body).startsWith("Hello student,").doesNotContain("last activity");
    }
}
