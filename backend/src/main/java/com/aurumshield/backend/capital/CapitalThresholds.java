package com.aurumshield.backend.capital;

import java.time.Duration;

/**
 * Every numeric threshold the capital engine uses, versioned and passed by value into each
 * calculation so a snapshot can be reproduced from the thresholds that produced it.
 */
public record CapitalThresholds(
        String version,
        double targetEcr,
        double reserveHaircut,
        double tvarAddonFactor,
        double hardstopCaution,
        double hardstopBreach,
        double hardstopExceeded,
        double hardstopThrottle,
        double hardstopFreeze,
        double ecrFreezeMultiplier,
        double ecrCriticalMultiplier,
        Duration bufferNegativeLookback,
        double throttleCapacityFraction,
        int topDriverCount
) {

    public static final CapitalThresholds DEFAULTS = new CapitalThresholds(
            "2026.1",
            8.0,
            0.35,
            0.12,
            0.80,
            0.95,
            1.0,
            0.90,
            0.93,
            1.05,
            1.2,
            Duration.ofMinutes(60),
            0.5,
            5
    );

    public double ecrFreezeLevel() {
        return targetEcr * ecrFreezeMultiplier;
    }

    public double ecrCriticalLevel() {
        return targetEcr * ecrCriticalMultiplier;
    }
}
