package com.aurumshield.backend.service;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * One governance audit entry. {@code id} is computed by the caller from the event's content so replays collapse.
 */
@Builder
public record AuditRecord(
        String id,
        Instant occurredAt,
        String actorRole,
        String actorUserId,
        String action,
        String resourceType,
        String resourceId,
        String result,
        String severity,
        String message,
        Map<String, Object> metadata
) {

    public static final String RESULT_SUCCESS = "SUCCESS";
    public static final String RESULT_DENIED = "DENIED";

    public static final String SEVERITY_INFO = "info";
    public static final String SEVERITY_WARNING = "warning";
    public static final String SEVERITY_CRITICAL = "critical";

    public static final String SYSTEM_ROLE = "system";
}
