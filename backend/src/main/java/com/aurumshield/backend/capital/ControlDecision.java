package com.aurumshield.backend.capital;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record ControlDecision(
        Instant asOf,
        ControlMode mode,
        List<String> reasons,
        Map<ControlAction, Boolean> blocks,
        ControlLimits limits,
        String snapshotHash,
        boolean available
) {

    public ControlDecision {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        blocks = blocks == null || blocks.isEmpty()
                ? mode.blockMatrix()
                : Collections.unmodifiableMap(new EnumMap<>(blocks));
        limits = limits == null ? ControlLimits.NONE : limits;
    }

    public boolean isBlocked(ControlAction action) {
        return Boolean.TRUE.equals(blocks.get(action));
    }
}
