package com.lms.backend.modules.notification.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.lms.backend.global.jpa.AbstractTimestampedEntity;
import com.lms.backend.modules.user.domain.LmsUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "notification")
public class InAppNotification extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private LmsUser user;

    @Column(name = "kind_code", nullable = false, length = 50)
    private String kindCode;

    @Column(name = "message", nullable = false)
    private String message;

    @Column(name = "correlation_id", columnDefinition = "uuid")
    private UUID correlationId;

    @Column(name = "sent_at", nullable = false)
    private OffsetDateTime sentAt;

    public UUID getId() {
        return id;
    }

    public LmsUser getUser() {
        return user;
    }

    public void setUser(LmsUser user) {
        this.user = user;
    }

    public String getKindCode() {
        return kindCode;
    }

    public void setKindCode(String kindCode) {
        this.kindCode = kindCode;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public UUID getCorrelationId() {
        return correlationId;
    }

    public void setCorrelationId(UUID correlationId) {
        this.correlationId = correlationId;
    }

    public OffsetDateTime getSentAt() {
        return sentAt;
    }

    public void setSentAt(OffsetDateTime sentAt) {
        this.sentAt = sentAt;
    }
}
