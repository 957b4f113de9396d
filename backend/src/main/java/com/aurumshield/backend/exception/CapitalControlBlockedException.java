package com.aurumshield.backend.exception;

import com.aurumshield.backend.capital.ControlAction;
import com.aurumshield.backend.capital.ControlMode;

import java.util.List;

/**
 * A mutating action was refused because the current capital control mode blocks it.
 */
public class CapitalControlBlockedException extends RuntimeException {

    private final ControlAction action;
    private final ControlMode mode;
    private final List<String> reasons;

    public CapitalControlBlockedException(ControlAction action, ControlMode mode, List<String> reasons) {
        super("CAPITAL_CONTROL_BLOCKED: Action \"" + action.label() + "\" is blocked under control mode " + mode
                + (reasons == null || reasons.isEmpty() ? "" : ". Reasons: " + String.join("; ", reasons)));
        this.action = action;
        this.mode = mode;
        this.reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public ControlAction getAction() {
        return action;
    }

    public ControlMode getMode() {
        return mode;
    }

    public List<String> getReasons() {
        return reasons;
    }
}
