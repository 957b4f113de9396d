package com.aurumshield.backend.capital;

import com.aurumshield.backend.util.MoneyUtils;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public final class CapitalFixtures {

    public static final Instant NOW = Instant.parse("2026-02-17T02:30:15Z");

    private CapitalFixtures() {
    }

    /** $100M capital base, $50M hardstop, $4.5M TVaR99. */
    public static CapitalBase standardCapital() {
        return new CapitalBase(MoneyUtils.bd(100_000_000), MoneyUtils.bd(50_000_000), MoneyUtils.bd(4_500_000),
                MoneyUtils.ZERO);
    }

    /** Standard capital with a single open settlement carrying the whole gross exposure. */
    public static ExposureState stateWithOpenSettlement(BigDecimal notional) {
        return new ExposureState(standardCapital(), List.of(), List.of(), List.of(),
                List.of(new SettlementCase("stl-1", "ord-1", MoneyUtils.bd(100), notional,
                        SettlementStatus.ESCROW_OPEN, NOW)),
                NOW);
    }

    public static CapitalSnapshot snapshot(double ecr, double utilization, BreachLevel level,
                                           BigDecimal grossExposure, List<ExposureDriver> drivers) {
        return new CapitalSnapshot(
                NOW,
                CapitalSnapshotCalculator.CALCULATION_MODE,
                CapitalThresholds.DEFAULTS.version(),
                MoneyUtils.bd(100_000_000),
                MoneyUtils.bd(50_000_000),
                grossExposure,
                MoneyUtils.ZERO,
                MoneyUtils.ZERO,
                grossExposure,
                MoneyUtils.ZERO,
                ecr,
                utilization,
                MoneyUtils.bd(10_000_000),
                level,
                List.of(),
                drivers);
    }

    public static ControlDecision decision(ControlMode mode) {
        return new ControlDecision(NOW, mode, List.of("test mode " + mode), mode.blockMatrix(), null, "0badcafe", true);
    }
}
