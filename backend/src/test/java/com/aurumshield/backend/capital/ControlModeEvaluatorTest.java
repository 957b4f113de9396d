package com.aurumshield.backend.capital;

import com.aurumshield.backend.util.MoneyUtils;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static com.aurumshield.backend.capital.CapitalFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;

class ControlModeEvaluatorTest {

    private final CapitalSnapshotCalculator calculator = new CapitalSnapshotCalculator();
    private final ControlModeEvaluator evaluator = new ControlModeEvaluator();

    @Test
    void hardstopBreachFreezesMarketplaceButKeepsSettlementOpen() {
        CapitalSnapshot snapshot = calculator.compute(
                CapitalFixtures.stateWithOpenSettlement(MoneyUtils.bd(49_000_000)), CapitalThresholds.DEFAULTS);

        ControlDecision decision = evaluator.evaluate(snapshot, List.of(), CapitalThresholds.DEFAULTS);

        assertThat(decision.mode()).isEqualTo(ControlMode.FREEZE_MARKETPLACE);
        assertThat(decision.isBlocked(ControlAction.PUBLISH_LISTING)).isTrue();
        assertThat(decision.isBlocked(ControlAction.CREATE_RESERVATION)).isTrue();
        assertThat(decision.isBlocked(ControlAction.OPEN_SETTLEMENT)).isFalse();
        assertThat(decision.isBlocked(ControlAction.EXECUTE_DVP)).isFalse();
        assertThat(decision.available()).isTrue();
        assertThat(decision.snapshotHash()).hasSize(8);
        assertThat(ControlMode.FREEZE_MARKETPLACE.blocks(ControlAction.OPEN_SETTLEMENT)).isFalse();
        assertThat(ControlMode.FREEZE_MARKETPLACE.blocks(ControlAction.PUBLISH_LISTING)).isTrue();
    }

    @Test
    void utilizationAboveHardstopHaltsEverything() {
        CapitalSnapshot snapshot = calculator.compute(
                CapitalFixtures.stateWithOpenSettlement(MoneyUtils.bd(51_000_000)), CapitalThresholds.DEFAULTS);

        ControlDecision decision = evaluator.evaluate(snapshot, List.of(), CapitalThresholds.DEFAULTS);

        assertThat(decision.mode()).isEqualTo(ControlMode.EMERGENCY_HALT);
        assertThat(decision.blocks().values()).containsOnly(true);
        assertThat(decision.reasons()).singleElement().asString().endsWith("EMERGENCY_HALT");
    }

    @Test
    void ecrAboveFreezeLevelFreezesConversions() {
        CapitalSnapshot snapshot = CapitalFixtures.snapshot(8.5, 0.70, BreachLevel.CAUTION,
                MoneyUtils.bd(35_000_000), List.of());

        ControlDecision decision = evaluator.evaluate(snapshot, List.of(), CapitalThresholds.DEFAULTS);

        assertThat(decision.mode()).isEqualTo(ControlMode.FREEZE_CONVERSIONS);
        assertThat(decision.isBlocked(ControlAction.CONVERT_RESERVATION)).isTrue();
        assertThat(decision.isBlocked(ControlAction.PUBLISH_LISTING)).isFalse();
    }

    @Test
    void throttlePublishesRemainingReservationCapacity() {
        CapitalSnapshot snapshot = CapitalFixtures.snapshot(0.45, 0.90, BreachLevel.CAUTION,
                MoneyUtils.bd(45_000_000), List.of());

        ControlDecision decision = evaluator.evaluate(snapshot, List.of(), CapitalThresholds.DEFAULTS);

        assertThat(decision.mode()).isEqualTo(ControlMode.THROTTLE_RESERVATIONS);
        assertThat(decision.limits().maxReservationNotional()).isEqualByComparingTo("2500000");
    }

    @Test
    void reservationAsTopDriverThrottlesInCaution() {
        ExposureDriver reservation = new ExposureDriver(DriverKind.RESERVATION, "Reservation res-1",
                MoneyUtils.bd(5_000_000), "res-1");
        CapitalSnapshot snapshot = CapitalFixtures.snapshot(0.41, 0.82, BreachLevel.CAUTION,
                MoneyUtils.bd(41_000_000), List.of(reservation));

        ControlDecision decision = evaluator.evaluate(snapshot, List.of(), CapitalThresholds.DEFAULTS);

        assertThat(decision.mode()).isEqualTo(ControlMode.THROTTLE_RESERVATIONS);
        assertThat(decision.reasons()).contains("Reserved notional is top exposure driver - THROTTLE_RESERVATIONS");
    }

    @Test
    void cautionWithoutTriggersStaysNormal() {
        CapitalSnapshot snapshot = CapitalFixtures.snapshot(0.41, 0.82, BreachLevel.CAUTION,
                MoneyUtils.bd(41_000_000), List.of());

        ControlDecision decision = evaluator.evaluate(snapshot, List.of(), CapitalThresholds.DEFAULTS);

        assertThat(decision.mode()).isEqualTo(ControlMode.NORMAL);
        assertThat(decision.reasons()).containsExactly(
                "Breach level CAUTION - no specific throttle triggers met. Mode remains NORMAL.");
    }

    @Test
    void recentNegativeBufferEventHaltsOnlyInsideLookback() {
        CapitalSnapshot snapshot = CapitalFixtures.snapshot(0.2, 0.4, BreachLevel.CLEAR,
                MoneyUtils.bd(20_000_000), List.of());
        BreachEvent recent = new BreachEvent("brch-1", NOW.minus(Duration.ofMinutes(59)),
                BreachEventType.BUFFER_NEGATIVE, BreachSeverity.WARN, "negative", snapshot);
        BreachEvent stale = new BreachEvent("brch-2", NOW.minus(Duration.ofMinutes(61)),
                BreachEventType.BUFFER_NEGATIVE, BreachSeverity.WARN, "negative", snapshot);

        assertThat(evaluator.evaluate(snapshot, List.of(recent), CapitalThresholds.DEFAULTS).mode())
                .isEqualTo(ControlMode.EMERGENCY_HALT);
        assertThat(evaluator.evaluate(snapshot, List.of(stale), CapitalThresholds.DEFAULTS).mode())
                .isEqualTo(ControlMode.NORMAL);
    }

    @Test
    void modeNeverDecreasesAsUtilizationRises() {
        ControlMode previous = ControlMode.NORMAL;
        for (int percent = 0; percent <= 110; percent++) {
            BigDecimal gross = MoneyUtils.scale(BigDecimal.valueOf(500_000L * percent));
            CapitalSnapshot snapshot = calculator.compute(
                    CapitalFixtures.stateWithOpenSettlement(gross), CapitalThresholds.DEFAULTS);
            ControlMode mode = evaluator.evaluate(snapshot, List.of(), CapitalThresholds.DEFAULTS).mode();
            assertThat(mode.severity())
                    .as("mode at %d%% utilization", percent)
                    .isGreaterThanOrEqualTo(previous.severity());
            previous = mode;
        }
        assertThat(previous).isEqualTo(ControlMode.EMERGENCY_HALT);
    }

    @Test
    void sameSnapshotGivesSameHash() {
        CapitalSnapshot snapshot = calculator.compute(
                CapitalFixtures.stateWithOpenSettlement(MoneyUtils.bd(10_000_000)), CapitalThresholds.DEFAULTS);

        assertThat(ControlModeEvaluator.snapshotHash(snapshot)).isEqualTo(ControlModeEvaluator.snapshotHash(snapshot));
        assertThat(evaluator.evaluate(snapshot, List.of(), CapitalThresholds.DEFAULTS).snapshotHash())
                .isEqualTo(ControlModeEvaluator.snapshotHash(snapshot));
    }

    @Test
    void unavailableDecisionIsMostRestrictive() {
        ControlDecision decision = evaluator.unavailable(NOW, "store down");

        assertThat(decision.mode()).isEqualTo(ControlMode.EMERGENCY_HALT);
        assertThat(decision.available()).isFalse();
        assertThat(decision.blocks().values()).containsOnly(true);
        assertThat(decision.reasons()).containsExactly(ControlModeEvaluator.UNAVAILABLE_REASON, "store down");
    }
}
