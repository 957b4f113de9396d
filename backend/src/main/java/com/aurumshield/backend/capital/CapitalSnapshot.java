package com.aurumshield.backend.capital;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time solvency view. Recomputed from current exposure state on every request.
 */
public record CapitalSnapshot(
        Instant asOf,
        String calculationMode,
        String thresholdsVersion,
        BigDecimal capitalBase,
        BigDecimal hardstopLimit,
        BigDecimal grossExposureNotional,
        BigDecimal reservedNotional,
        BigDecimal allocatedNotional,
        BigDecimal settlementNotionalOpen,
        BigDecimal settledNotionalToday,
        double ecr,
        double hardstopUtilization,
        BigDecimal bufferVsTvar99,
        BreachLevel breachLevel,
        List<String> breachReasons,
        List<ExposureDriver> topDrivers
) {

    public CapitalSnapshot {
        breachReasons = breachReasons == null ? List.of() : List.copyOf(breachReasons);
        topDrivers = topDrivers == null ? List.of() : List.copyOf(topDrivers);
    }

    public boolean reservationIsTopDriver() {
        return !topDrivers.isEmpty() && topDrivers.get(0).kind() == DriverKind.RESERVATION;
    }
}
