package com.aurumshield.backend.capital;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A control decision with active overrides merged in.
 *
 * @param effectiveBlocks block matrix after overrides
 * @param clearedBy       override id that lifted each action, only for actions the base decision blocked
 * @param appliedOverrideIds overrides that changed at least one block
 */
public record EffectiveControlDecision(
        ControlDecision decision,
        Map<ControlAction, Boolean> effectiveBlocks,
        Map<ControlAction, String> clearedBy,
        List<String> appliedOverrideIds
) {

    public EffectiveControlDecision {
        effectiveBlocks = Collections.unmodifiableMap(new EnumMap<>(effectiveBlocks));
        clearedBy = clearedBy.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(clearedBy));
        appliedOverrideIds = List.copyOf(appliedOverrideIds);
    }

    public static EffectiveControlDecision unchanged(ControlDecision decision) {
        return new EffectiveControlDecision(decision, decision.blocks(), Map.of(), List.of());
    }

    public ControlMode mode() {
        return decision.mode();
    }

    public boolean isBlocked(ControlAction action) {
        return Boolean.TRUE.equals(effectiveBlocks.get(action));
    }

    public boolean isOverridden(ControlAction action) {
        return clearedBy.containsKey(action);
    }
}
