package com.aurumshield.backend.dto;

import com.aurumshield.backend.capital.CapitalOverride;
import com.aurumshield.backend.capital.ControlAction;
import com.aurumshield.backend.capital.ControlMode;
import com.aurumshield.backend.capital.OverrideScopeType;
import com.aurumshield.backend.capital.OverrideStatus;

import java.time.Instant;

public record OverrideView(
        String id,
        OverrideScopeType scope,
        ControlAction actionKey,
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

    public static OverrideView from(CapitalOverride override) {
        return new OverrideView(
                override.id(),
                override.scope().type(),
                override.scope().actionKey(),
                override.reason(),
                override.createdAt(),
                override.expiresAt(),
                override.status(),
                override.actorRole(),
                override.actorUserId(),
                override.actorName(),
                override.revokedAt(),
                override.revokedBy(),
                override.snapshotHash(),
                override.modeAtCreation());
    }
}
