package com.lms.backend.modules.notification.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.lms.backend.modules.notification.domain.InAppNotification;

public interface InAppNotificationRepository extends JpaRepository<InAppNotification, UUID> {

    long countBySentAtGreaterThanEqual(OffsetDateTime since);

    List<InAppNotification> findByCorrelationId(UUID correlationId);
}
