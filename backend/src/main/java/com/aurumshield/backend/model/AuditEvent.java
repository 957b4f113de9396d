package com.aurumshield.backend.model;

import com.aurumshield.backend.entity.AssignedIdEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "audit_events")
@Data
@EqualsAndHashCode(callSuper = false)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent extends AssignedIdEntity {

    @Id
    @Column(length = 128)
    private String id;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "actor_role", nullable = false, length = 64)
    private String actorRole;

    @Column(name = "actor_user_id", length = 64)
    private String actorUserId;

    @Column(name = "action", nullable = false, length = 64)
    private String action;

    @Column(name = "resource_type", nullable = false, length = 64)
    private String resourceType;

    @Column(name = "resource_id", length = 128)
    private String resourceId;

    @Column(nullable = false, length = 16)
    private String result;

    @Column(nullable = false, length = 16)
    private String severity;

    @Column(length = 1024)
    private String message;

    @Column(columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "correlation_id", length = 100)
    private String correlationId;
}
