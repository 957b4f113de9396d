package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.CapitalOverride;
import com.aurumshield.backend.capital.ControlDecision;
import com.aurumshield.backend.capital.ControlMode;

import java.util.List;

/**
 * @param previousMode mode recorded by the prior sweep, null on the first sweep
 */
public record ControlsSweepResult(
        ControlDecision decision,
        List<CapitalOverride> overrides,
        List<CapitalOverride> expiredOverrides,
        ControlMode previousMode,
        boolean modeChanged
) {}
