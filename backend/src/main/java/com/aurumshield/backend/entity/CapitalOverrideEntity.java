package com.aurumshield.backend.entity;

import com.aurumshield.backend.capital.ControlAction;
import com.aurumshield.backend.capital.ControlMode;
import com.aurumshield.backend.capital.OverrideScopeType;
import com.aurumshield.backend.capital.OverrideStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "capital_overrides")
@Data
@EqualsAndHashCode(callSuper = false)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapitalOverrideEntity extends AssignedIdEntity {

    @Id
    @Column(length = 128)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope_type", nullable = false, length = 16)
    private OverrideScopeType scopeType;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_key", length = 32)
    private ControlAction actionKey;

    @Column(nullable = false, length = 1024)
    private String reason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OverrideStatus status;

    @Column(name = "actor_role", nullable = false, length = 64)
    private String actorRole;

    @Column(name = "actor_user_id", nullable = false, length = 64)
    private String actorUserId;

    @Column(name = "actor_name", length = 128)
    private String actorName;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "revoked_by", length = 64)
    private String revokedBy;

    @Column(name = "snapshot_hash", length = 16)
    private String snapshotHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode_at_creation", nullable = false, length = 32)
    private ControlMode modeAtCreation;
}
