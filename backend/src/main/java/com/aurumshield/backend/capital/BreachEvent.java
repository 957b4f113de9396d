package com.aurumshield.backend.capital;

import java.time.Instant;

/**
 * Append-only governance alert. The id is content-addressed so the same condition observed
 * twice in one minute maps to the same event.
 */
public record BreachEvent(
        String id,
        Instant occurredAt,
        BreachEventType type,
        BreachSeverity level,
        String message,
        CapitalSnapshot snapshot
) {}
