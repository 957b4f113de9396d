package com.aurumshield.backend.capital;

import java.time.Instant;

/**
 * Time-boxed, attributed exception to a capital control block.
 */
public record CapitalOverride(
        String id,
        OverrideScope scope,
        String reason,
        Instant createdAt,
        Instant expiresAt,
        OverrideStatus status,
        String actorRole,
        String actorUserId,
        String actorName,
        Instant revokedAt,
        String revokedBy,
        String snapshotHash,
        ControlMode modeAtCreation
) {

    /**
     * Stored status with expiry applied: an ACTIVE override whose {@code expiresAt} has passed reads as EXPIRED.
     */
    public OverrideStatus effectiveStatus(Instant now) {
        if (status == OverrideStatus.ACTIVE && !expiresAt.isAfter(now)) {
            return OverrideStatus.EXPIRED;
        }
        return status;
    }

    public boolean isActiveAt(Instant now) {
        return effectiveStatus(now) == OverrideStatus.ACTIVE;
    }

    public boolean isGlobal() {
        return scope.type() == OverrideScopeType.GLOBAL;
    }

    public CapitalOverride withStatus(OverrideStatus next, Instant at, String by) {
        return new CapitalOverride(id, scope, reason, createdAt, expiresAt, next, actorRole, actorUserId, actorName,
                next == OverrideStatus.REVOKED ? at : revokedAt,
                next == OverrideStatus.REVOKED ? by : revokedBy,
                snapshotHash, modeAtCreation);
    }
}
