package com.aurumshield.backend.capital;

import com.aurumshield.backend.util.MoneyUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns aggregate exposure state into a {@link CapitalSnapshot}. Stateless and side-effect free.
 */
@Component
public class CapitalSnapshotCalculator {

    public static final String CALCULATION_MODE = "LIVE";

    public CapitalSnapshot compute(ExposureState state, CapitalThresholds thresholds) {
        CapitalBase capital = state.capital();
        LocalDate today = state.now().atZone(ZoneOffset.UTC).toLocalDate();

        BigDecimal reservedNotional = MoneyUtils.ZERO;
        BigDecimal allocatedNotional = MoneyUtils.ZERO;
        Map<String, BigDecimal> convertedWeightByListing = new HashMap<>();
        for (Reservation reservation : state.reservations()) {
            BigDecimal notional = MoneyUtils.multiply(reservation.weightOz(), reservation.pricePerOzLocked());
            if (reservation.state() == ReservationState.ACTIVE) {
                reservedNotional = MoneyUtils.add(reservedNotional, notional);
            } else if (reservation.state() == ReservationState.CONVERTED) {
                allocatedNotional = MoneyUtils.add(allocatedNotional, notional);
                convertedWeightByListing.merge(reservation.listingId(), MoneyUtils.scale(reservation.weightOz()), MoneyUtils::add);
            }
        }

        for (InventoryPosition position : state.inventory()) {
            BigDecimal allocatedWeight = MoneyUtils.scale(position.allocatedWeightOz());
            if (allocatedWeight.signum() <= 0) {
                continue;
            }
            List<MarketOrder> listingOrders = state.orders().stream()
                    .filter(order -> order.listingId() != null && order.listingId().equals(position.listingId()))
                    .toList();
            if (listingOrders.isEmpty()) {
                continue;
            }
            BigDecimal priceSum = listingOrders.stream()
                    .map(MarketOrder::pricePerOz)
                    .reduce(MoneyUtils.ZERO, MoneyUtils::add);
            BigDecimal averagePrice = MoneyUtils.scale(priceSum.divide(BigDecimal.valueOf(listingOrders.size()), MathContext.DECIMAL64));
            BigDecimal covered = convertedWeightByListing.getOrDefault(position.listingId(), MoneyUtils.ZERO);
            BigDecimal uncovered = MoneyUtils.floorAtZero(MoneyUtils.subtract(allocatedWeight, covered));
            allocatedNotional = MoneyUtils.add(allocatedNotional, MoneyUtils.multiply(uncovered, averagePrice));
        }

        BigDecimal settlementNotionalOpen = MoneyUtils.ZERO;
        BigDecimal settledNotionalToday = MoneyUtils.ZERO;
        for (SettlementCase settlement : state.settlements()) {
            if (settlement.status() != null && settlement.status().isOpen()) {
                settlementNotionalOpen = MoneyUtils.add(settlementNotionalOpen, settlement.notionalUsd());
            }
            if (settlement.status() == SettlementStatus.SETTLED
                    && settlement.updatedAt() != null
                    && settlement.updatedAt().atZone(ZoneOffset.UTC).toLocalDate().isEqual(today)) {
                settledNotionalToday = MoneyUtils.add(settledNotionalToday, settlement.notionalUsd());
            }
        }

        BigDecimal grossExposure = MoneyUtils.add(
                MoneyUtils.add(allocatedNotional, settlementNotionalOpen),
                MoneyUtils.multiply(reservedNotional, thresholds.reserveHaircut()));

        BigDecimal capitalBase = MoneyUtils.scale(capital.capitalBase());
        BigDecimal hardstopLimit = MoneyUtils.scale(capital.hardstopLimit());
        double ecr = MoneyUtils.ratio(grossExposure, capitalBase);
        double hardstopUtilization = MoneyUtils.ratio(grossExposure, hardstopLimit);

        BigDecimal bufferVsTvar99 = MoneyUtils.subtract(
                MoneyUtils.subtract(capitalBase, capital.tvar99()),
                MoneyUtils.multiply(grossExposure, thresholds.tvarAddonFactor()));

        List<String> reasons = new ArrayList<>();
        BreachLevel level = classify(ecr, hardstopUtilization, bufferVsTvar99, thresholds, reasons);

        return new CapitalSnapshot(
                state.now(),
                CALCULATION_MODE,
                thresholds.version(),
                capitalBase,
                hardstopLimit,
                grossExposure,
                reservedNotional,
                allocatedNotional,
                settlementNotionalOpen,
                settledNotionalToday,
                ecr,
                hardstopUtilization,
                bufferVsTvar99,
                level,
                reasons,
                topDrivers(state, thresholds)
        );
    }

    private BreachLevel classify(double ecr, double utilization, BigDecimal buffer,
                                 CapitalThresholds thresholds, List<String> reasons) {
        BreachLevel level = BreachLevel.CLEAR;

        if (utilization >= thresholds.hardstopExceeded()) {
            level = BreachLevel.BREACH;
            reasons.add(String.format(Locale.ROOT, "Hardstop utilization %s ≥ %.0f%% - EXCEEDED",
                    percent(utilization), thresholds.hardstopExceeded() * 100));
        } else if (utilization >= thresholds.hardstopBreach()) {
            level = BreachLevel.BREACH;
            reasons.add(String.format(Locale.ROOT, "Hardstop utilization %s ≥ %.0f%% threshold",
                    percent(utilization), thresholds.hardstopBreach() * 100));
        }

        if (level == BreachLevel.CLEAR) {
            if (utilization >= thresholds.hardstopCaution()) {
                level = BreachLevel.CAUTION;
                reasons.add(String.format(Locale.ROOT, "Hardstop utilization %s in %.0f-%.0f%% caution band",
                        percent(utilization), thresholds.hardstopCaution() * 100, thresholds.hardstopBreach() * 100));
            }
            if (ecr >= thresholds.targetEcr()) {
                level = BreachLevel.CAUTION;
                reasons.add(String.format(Locale.ROOT, "ECR %.4fx exceeds target %.1fx", ecr, thresholds.targetEcr()));
            }
        }

        if (buffer.signum() < 0 && level == BreachLevel.CLEAR) {
            level = BreachLevel.CAUTION;
            reasons.add("Buffer vs TVaR99 is negative: $" + String.format(Locale.US, "%,.0f", buffer.abs()));
        }
        return level;
    }

    private List<ExposureDriver> topDrivers(ExposureState state, CapitalThresholds thresholds) {
        List<ExposureDriver> drivers = new ArrayList<>();
        for (Reservation reservation : state.reservations()) {
            if (reservation.state() == ReservationState.ACTIVE) {
                BigDecimal value = MoneyUtils.multiply(
                        MoneyUtils.multiply(reservation.weightOz(), reservation.pricePerOzLocked()),
                        thresholds.reserveHaircut());
                drivers.add(new ExposureDriver(DriverKind.RESERVATION,
                        "Reservation " + reservation.id() + " (" + plain(reservation.weightOz()) + " oz ACTIVE)",
                        value, reservation.id()));
            }
        }
        for (MarketOrder order : state.orders()) {
            if (order.status() != null && !order.status().isTerminal()) {
                drivers.add(new ExposureDriver(DriverKind.ORDER,
                        "Order " + order.id() + " (" + plain(order.weightOz()) + " oz " + order.status() + ")",
                        MoneyUtils.scale(order.notional()), order.id()));
            }
        }
        for (SettlementCase settlement : state.settlements()) {
            if (settlement.status() != null && settlement.status().isOpen()) {
                drivers.add(new ExposureDriver(DriverKind.SETTLEMENT,
                        "Settlement " + settlement.id() + " (" + plain(settlement.weightOz()) + " oz " + settlement.status() + ")",
                        MoneyUtils.scale(settlement.notionalUsd()), settlement.id()));
            }
        }
        drivers.sort(Comparator.comparing(ExposureDriver::value).reversed());
        return drivers.stream().limit(thresholds.topDriverCount()).toList();
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.2f%%", ratio * 100);
    }

    private static String plain(BigDecimal value) {
        return value == null ? "0" : value.stripTrailingZeros().toPlainString();
    }
}
