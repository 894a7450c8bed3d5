package com.lms.backend.modules.notification.infrastructure.mail;

import com.lms.backend.modules.notification.application.MailTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * Plain-text SMTP delivery through Spring's {@link JavaMailSender} ({@code spring.mail.*} settings).
 */
@Component
public class SmtpMailTransport implements MailTransport {

    private static final Logger log = LoggerFactory.getLogger(SmtpMailTransport.class);

    private final JavaMailSender mailSender;
    private final String fromAddress;

    public SmtpMailTransport(
            JavaMailSender mailSender,
            @Value("${lms.inactivity.mail.from:LMS Notifications <no-reply@lms.local>}") String fromAddress
    ) {
        this.mailSender = mailSender;
        this.fromAddress = fromAddress;
    }

    @Override
    public TransportResult send(String toAddress, String subject, String body) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(fromAddress);
        message.setTo(toAddress);
        message.setSubject(subject);
        message.setText(body);
        try {
            mailSender.send(message);
            return TransportResult.success();
        } catch (MailException ex) {
            log.debug("SMTP delivery to {} failed", toAddress, ex);
            return TransportResult.failure(describe(ex));
        }
    }

    private static String describe(MailException ex) {
        Throwable root = ex.getMostSpecificCause();
        String message = root.getMessage() != null ? root.getMessage() : ex.getMessage();
        return ex.getClass().getSimpleName() + ": " + message;
    }
}
