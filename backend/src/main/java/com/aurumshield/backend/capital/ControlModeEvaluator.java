package com.aurumshield.backend.capital;

import com.aurumshield.backend.util.Fingerprints;
import com.aurumshield.backend.util.MoneyUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Derives the platform control mode from a snapshot and recent breach history.
 * Every call evaluates from scratch; no state is carried between calls.
 */
@Component
public class ControlModeEvaluator {

    public static final String UNAVAILABLE_REASON =
            "Capital control decision unavailable - treating as most restrictive mode";

    public ControlDecision evaluate(CapitalSnapshot snapshot, Collection<BreachEvent> recentBreachEvents,
                                    CapitalThresholds thresholds) {
        Instant asOf = snapshot.asOf();
        double utilization = snapshot.hardstopUtilization();
        List<String> reasons = new ArrayList<>();

        if (utilization >= thresholds.hardstopExceeded()) {
            reasons.add(String.format(Locale.ROOT, "Hardstop utilization %s ≥ %.0f%% - EMERGENCY_HALT",
                    percent(utilization), thresholds.hardstopExceeded() * 100));
            return decision(snapshot, ControlMode.EMERGENCY_HALT, reasons, ControlLimits.NONE);
        }

        Instant cutoff = asOf.minus(thresholds.bufferNegativeLookback());
        boolean recentBufferNegative = recentBreachEvents != null && recentBreachEvents.stream()
                .anyMatch(event -> event.type() == BreachEventType.BUFFER_NEGATIVE
                        && !event.occurredAt().isBefore(cutoff));
        if (recentBufferNegative) {
            reasons.add(String.format(Locale.ROOT,
                    "BUFFER_NEGATIVE breach event detected within last %d minutes - EMERGENCY_HALT",
                    thresholds.bufferNegativeLookback().toMinutes()));
            return decision(snapshot, ControlMode.EMERGENCY_HALT, reasons, ControlLimits.NONE);
        }

        if (snapshot.breachLevel() == BreachLevel.BREACH) {
            reasons.add(String.format(Locale.ROOT, "Breach level BREACH with HU %s - FREEZE_MARKETPLACE",
                    percent(utilization)));
            return decision(snapshot, ControlMode.FREEZE_MARKETPLACE, reasons, ControlLimits.NONE);
        }

        if (snapshot.breachLevel() == BreachLevel.CAUTION) {
            return evaluateCaution(snapshot, thresholds, reasons);
        }

        return decision(snapshot, ControlMode.NORMAL, reasons, ControlLimits.NONE);
    }

    private ControlDecision evaluateCaution(CapitalSnapshot snapshot, CapitalThresholds thresholds, List<String> reasons) {
        double utilization = snapshot.hardstopUtilization();
        boolean ecrFreeze = snapshot.ecr() >= thresholds.ecrFreezeLevel();
        boolean utilizationFreeze = utilization >= thresholds.hardstopFreeze();
        if (ecrFreeze || utilizationFreeze) {
            if (ecrFreeze) {
                reasons.add(String.format(Locale.ROOT, "ECR %.2fx ≥ %.1fx (target × %.2f) - FREEZE_CONVERSIONS",
                        snapshot.ecr(), thresholds.ecrFreezeLevel(), thresholds.ecrFreezeMultiplier()));
            }
            if (utilizationFreeze) {
                reasons.add(String.format(Locale.ROOT, "Hardstop utilization %s ≥ %.0f%% - FREEZE_CONVERSIONS",
                        percent(utilization), thresholds.hardstopFreeze() * 100));
            }
            return decision(snapshot, ControlMode.FREEZE_CONVERSIONS, reasons, ControlLimits.NONE);
        }

        boolean reservationTopDriver = snapshot.reservationIsTopDriver();
        boolean utilizationThrottle = utilization >= thresholds.hardstopThrottle();
        if (reservationTopDriver || utilizationThrottle) {
            if (reservationTopDriver) {
                reasons.add("Reserved notional is top exposure driver - THROTTLE_RESERVATIONS");
            }
            if (utilizationThrottle) {
                reasons.add(String.format(Locale.ROOT, "Hardstop utilization %s ≥ %.0f%% - THROTTLE_RESERVATIONS",
                        percent(utilization), thresholds.hardstopThrottle() * 100));
            }
            BigDecimal remaining = MoneyUtils.subtract(snapshot.hardstopLimit(), snapshot.grossExposureNotional());
            BigDecimal cap = MoneyUtils.floorAtZero(MoneyUtils.multiply(remaining, thresholds.throttleCapacityFraction()));
            return decision(snapshot, ControlMode.THROTTLE_RESERVATIONS, reasons, new ControlLimits(cap, null));
        }

        reasons.add("Breach level CAUTION - no specific throttle triggers met. Mode remains NORMAL.");
        return decision(snapshot, ControlMode.NORMAL, reasons, ControlLimits.NONE);
    }

    /**
     * Fail-safe result used when the decision cannot be computed.
     */
    public ControlDecision unavailable(Instant asOf, String cause) {
        List<String> reasons = new ArrayList<>();
        reasons.add(UNAVAILABLE_REASON);
        if (cause != null && !cause.isBlank()) {
            reasons.add(cause);
        }
        return new ControlDecision(asOf, ControlMode.EMERGENCY_HALT, reasons,
                ControlMode.EMERGENCY_HALT.blockMatrix(), ControlLimits.NONE, null, false);
    }

    /**
     * Binds a decision to the snapshot minute and key ratios it was computed from.
     */
    public static String snapshotHash(CapitalSnapshot snapshot) {
        return Fingerprints.fingerprint(
                Fingerprints.minuteBucket(snapshot.asOf()),
                Fingerprints.fixed(snapshot.ecr(), 4),
                Fingerprints.fixed(snapshot.hardstopUtilization(), 4),
                snapshot.breachLevel().name(),
                Fingerprints.fixed(snapshot.grossExposureNotional().doubleValue(), 2),
                Fingerprints.fixed(snapshot.capitalBase().doubleValue(), 2));
    }

    private ControlDecision decision(CapitalSnapshot snapshot, ControlMode mode, List<String> reasons, ControlLimits limits) {
        return new ControlDecision(snapshot.asOf(), mode, reasons, mode.blockMatrix(), limits, snapshotHash(snapshot), true);
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.2f%%", ratio * 100);
    }
}
