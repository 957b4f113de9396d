package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.BreachEvent;
import com.aurumshield.backend.capital.CapitalSnapshot;
import com.aurumshield.backend.capital.ControlDecision;
import com.aurumshield.backend.dto.OverrideView;

import java.time.Instant;
import java.util.List;

/**
 * Committee export: breaches from the last 24 hours, active overrides plus the most recent inactive ones,
 * and the ids of every capital governance audit record.
 */
public record ControlsPacket(
        int packetVersion,
        Instant generatedAt,
        CapitalSnapshot snapshot,
        List<BreachEvent> breachEvents,
        ControlDecision controlDecision,
        List<OverrideView> overrides,
        List<String> auditEventIds
) {

    public static final int VERSION = 2;
}
