package com.aurumshield.backend.capital;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Escalating platform control state. Each level blocks everything the level below blocks plus
 * one more group of actions.
 */
public enum ControlMode {
    NORMAL(0, EnumSet.noneOf(ControlAction.class)),
    THROTTLE_RESERVATIONS(1, EnumSet.of(ControlAction.CREATE_RESERVATION)),
    FREEZE_CONVERSIONS(2, EnumSet.of(ControlAction.CREATE_RESERVATION, ControlAction.CONVERT_RESERVATION)),
    FREEZE_MARKETPLACE(3, EnumSet.of(ControlAction.CREATE_RESERVATION, ControlAction.CONVERT_RESERVATION,
            ControlAction.PUBLISH_LISTING)),
    EMERGENCY_HALT(4, EnumSet.allOf(ControlAction.class));

    private final int severity;
    private final Set<ControlAction> blocked;

    ControlMode(int severity, Set<ControlAction> blocked) {
        this.severity = severity;
        this.blocked = Collections.unmodifiableSet(blocked);
    }

    public int severity() {
        return severity;
    }

    public boolean blocks(ControlAction action) {
        return blocked.contains(action);
    }

    /** Full block matrix over every action key. */
    public Map<ControlAction, Boolean> blockMatrix() {
        Map<ControlAction, Boolean> matrix = new EnumMap<>(ControlAction.class);
        for (ControlAction action : ControlAction.values()) {
            matrix.put(action, blocks(action));
        }
        return Collections.unmodifiableMap(matrix);
    }

    /** Only these modes may be lifted by a GLOBAL override. */
    public boolean isGloballyOverridable() {
        return this == THROTTLE_RESERVATIONS || this == FREEZE_CONVERSIONS;
    }

    public ControlMode oneLevelDown() {
        return this == NORMAL ? NORMAL : values()[ordinal() - 1];
    }

    public boolean isMoreSevereThan(ControlMode other) {
        return severity > other.severity;
    }
}
