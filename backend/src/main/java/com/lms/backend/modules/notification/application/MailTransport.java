package com.lms.backend.modules.notification.application;

/**
 * Outbound mail port. Implementations report failures through {@link TransportResult} instead of throwing.
 */
public interface MailTransport {

    TransportResult send(String toAddress, String subject, String body);

    record TransportResult(boolean delivered, String reason) {

        public static TransportResult success() {
            return new TransportResult(true, null);
        }

        public static TransportResult failure(String reason) {
            return new TransportResult(false, reason == null || reason.isBlank() ? "unknown transport error" : reason);
        }
    }
}
