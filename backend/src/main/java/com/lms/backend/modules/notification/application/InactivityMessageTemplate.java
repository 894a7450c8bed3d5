package com.lms.backend.modules.notification.application;

import java.time.format.DateTimeFormatter;

import com.lms.backend.modules.activity.domain.InactiveCandidate;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class InactivityMessageTemplate {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final String subject;

    public InactivityMessageTemplate(
            @Value("${lms.inactivity.mail.subject:We miss you in your online courses!}") String subject
    ) {
        this.subject = subject;
    }

    public String subject() {
        return subject;
    }

    public String body(InactiveCandidate candidate) {
        String name = candidate.user().displayName();
        StringBuilder body = new StringBuilder()
                .append("Hello ").append(name).append(",\n\n");

        if (candidate.isNeverActive()) {
            body.append("Your LMS account is ready, but we haven't seen you in any of your courses yet.\n")
                    .append("Log in to get started with your learning journey!\n");
        } else {
            long days = candidate.daysInactive();
            body.append("We've noticed that you haven't been active in your courses for ")
                    .append(days).append(days == 1 ? " day" : " days").append(".\n")
                    .append("Your last activity was on ")
                    .append(candidate.user().lastActive().format(DATE_FORMAT)).append(".\n\n")
                    .append("Please log in to continue your learning journey!\n");
        }

        return body.append("\nBest regards,\nThe LMS Team\n").toString();
    }
}
