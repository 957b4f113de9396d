package com.aurumshield.backend.policy;

import com.aurumshield.backend.capital.CapitalBase;
import com.aurumshield.backend.util.MoneyUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic transaction risk scoring: TRI, capital impact, blockers, approval tier and the compliance checklist.
 * Same inputs always give the same output; every numeric threshold comes from {@link RiskConfiguration}.
 */
@Component
public class TransactionRiskScorer {

    static final double WEIGHT_COUNTERPARTY_RISK = 0.40;
    static final double WEIGHT_CORRIDOR_RISK = 0.25;
    static final double WEIGHT_AMOUNT_CONCENTRATION = 0.20;
    static final double WEIGHT_COUNTERPARTY_STATUS = 0.15;

    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000);

    public TriResult computeTri(Counterparty counterparty, Corridor corridor, BigDecimal amount, CapitalBase capital) {
        int cpRisk = counterparty.riskLevel().weight();
        int corridorRisk = corridor.riskLevel().weight();
        double amountRatio = MoneyUtils.ratio(amount, capital.hardstopLimit());
        int amountScore = (int) Math.min(10, Math.max(1, Math.ceil(amountRatio * 20)));
        int cpStatus = counterparty.status() == null ? 0 : counterparty.status().weight();

        double raw = cpRisk * WEIGHT_COUNTERPARTY_RISK
                + corridorRisk * WEIGHT_CORRIDOR_RISK
                + amountScore * WEIGHT_AMOUNT_CONCENTRATION
                + cpStatus * WEIGHT_COUNTERPARTY_STATUS;
        int score = (int) Math.min(10, Math.max(1, Math.round(raw)));

        String formula = String.format(Locale.ROOT,
                "TRI = (CP_Risk:%d × %s) + (Corridor_Risk:%d × %s) + (Amt_Conc:%d × %s) + (CP_Status:%d × %s) = %.2f → %d",
                cpRisk, number(WEIGHT_COUNTERPARTY_RISK),
                corridorRisk, number(WEIGHT_CORRIDOR_RISK),
                amountScore, number(WEIGHT_AMOUNT_CONCENTRATION),
                cpStatus, number(WEIGHT_COUNTERPARTY_STATUS),
                raw, score);

        return new TriResult(
                score,
                TriBand.forScore(score),
                TriComponent.of(WEIGHT_COUNTERPARTY_RISK, cpRisk),
                TriComponent.of(WEIGHT_CORRIDOR_RISK, corridorRisk),
                TriComponent.of(WEIGHT_AMOUNT_CONCENTRATION, amountScore),
                TriComponent.of(WEIGHT_COUNTERPARTY_STATUS, cpStatus),
                raw,
                formula);
    }

    public CapitalValidation validateCapital(BigDecimal amount, CapitalBase capital) {
        BigDecimal current = MoneyUtils.scale(capital.activeExposure());
        BigDecimal post = MoneyUtils.add(current, amount);
        return new CapitalValidation(
                current,
                post,
                MoneyUtils.scale(capital.capitalBase()),
                MoneyUtils.ratio(current, capital.capitalBase()),
                MoneyUtils.ratio(post, capital.capitalBase()),
                MoneyUtils.scale(capital.hardstopLimit()),
                MoneyUtils.ratio(current, capital.hardstopLimit()),
                MoneyUtils.ratio(post, capital.hardstopLimit()),
                MoneyUtils.subtract(capital.hardstopLimit(), current));
    }

    /**
     * Collects blockers. Counterparty, corridor, hub and TRI may be {@code null} while a transaction is still being
     * assembled; the related checks are then skipped.
     */
    public List<PolicyBlocker> checkBlockers(Counterparty counterparty, Corridor corridor, Hub hub, TriResult tri,
                                             BigDecimal amount, CapitalBase capital, RiskConfiguration config) {
        List<PolicyBlocker> blockers = new ArrayList<>();
        if (counterparty != null && counterparty.status() != null) {
            switch (counterparty.status()) {
                case SUSPENDED -> blockers.add(new PolicyBlocker("cp-susp", BlockerSeverity.BLOCK,
                        "Counterparty Suspended", counterparty.entity() + " is suspended - transactions blocked."));
                case UNDER_REVIEW -> blockers.add(new PolicyBlocker("cp-rev", BlockerSeverity.WARN,
                        "Counterparty Under Review", counterparty.entity() + " is under active review."));
                case PENDING -> blockers.add(new PolicyBlocker("cp-pend", BlockerSeverity.INFO,
                        "Counterparty Pending", counterparty.entity() + " KYC/onboarding pending."));
                default -> {
                }
            }
        }
        if (corridor != null && corridor.status() == CorridorStatus.SUSPENDED) {
            blockers.add(new PolicyBlocker("cor-susp", BlockerSeverity.BLOCK,
                    "Corridor Suspended", corridor.name() + " corridor suspended."));
        }
        if (corridor != null && corridor.status() == CorridorStatus.RESTRICTED) {
            blockers.add(new PolicyBlocker("cor-rest", BlockerSeverity.WARN,
                    "Corridor Restricted", corridor.name() + " restricted - enhanced due diligence."));
        }
        if (hub != null && hub.status() != null) {
            switch (hub.status()) {
                case OFFLINE -> blockers.add(new PolicyBlocker("hub-off", BlockerSeverity.BLOCK,
                        "Hub Offline", hub.name() + " is offline."));
                case MAINTENANCE -> blockers.add(new PolicyBlocker("hub-maint", BlockerSeverity.WARN,
                        "Hub Maintenance", hub.name() + " under maintenance - delays possible."));
                case DEGRADED -> blockers.add(new PolicyBlocker("hub-deg", BlockerSeverity.WARN,
                        "Hub Degraded", hub.name() + " degraded mode."));
                default -> {
                }
            }
        }

        BigDecimal remaining = MoneyUtils.subtract(capital.hardstopLimit(), capital.activeExposure());
        if (amount.compareTo(remaining) > 0) {
            blockers.add(new PolicyBlocker("hs-breach", BlockerSeverity.BLOCK, "Hardstop Breach",
                    String.format(Locale.ROOT, "Amount exceeds remaining capacity ($%.1fM).", millions(remaining))));
        }

        double postEcr = MoneyUtils.ratio(MoneyUtils.add(capital.activeExposure(), amount), capital.capitalBase());
        if (postEcr > config.maxEcrRatio()) {
            blockers.add(new PolicyBlocker("ecr-breach", BlockerSeverity.BLOCK, "ECR Breach",
                    String.format(Locale.ROOT, "Post-transaction ECR %.2fx exceeds %sx limit.",
                            postEcr, number(config.maxEcrRatio()))));
        }

        if (tri != null && tri.score() >= config.triCriticalThreshold()
                && amount.compareTo(MoneyUtils.multiply(remaining, config.triConcentrationFactor())) > 0) {
            blockers.add(new PolicyBlocker("tri-conc", BlockerSeverity.BLOCK, "High-Risk Concentration",
                    String.format(Locale.ROOT, "TRI ≥ %d and amount > %.0f%% of remaining hardstop.",
                            config.triCriticalThreshold(), config.triConcentrationFactor() * 100)));
        }
        if (tri != null && tri.score() >= config.triElevatedThreshold()) {
            blockers.add(new PolicyBlocker("tri-high", BlockerSeverity.WARN, "Elevated TRI",
                    "TRI " + tri.score() + " (Red band) - enhanced monitoring."));
        }
        return blockers;
    }

    public static boolean hasBlockLevel(List<PolicyBlocker> blockers) {
        return blockers.stream().anyMatch(PolicyBlocker::isBlocking);
    }

    /**
     * First matching tier wins: AUTO, DESK_HEAD, CREDIT_COMMITTEE, then BOARD.
     */
    public ApprovalResult determineApproval(int triScore, BigDecimal amount, RiskConfiguration config) {
        BigDecimal autoLimit = config.autoApprovalLimit();
        BigDecimal deskLimit = config.deskHeadLimit();
        BigDecimal committeeLimit = config.creditCommitteeLimit();

        if (triScore <= 3 && amount.compareTo(autoLimit) <= 0) {
            return ApprovalResult.of(ApprovalTier.AUTO,
                    String.format(Locale.ROOT, "TRI ≤ 3 AND amount ≤ $%.0fM", millions(autoLimit)));
        }
        if (triScore <= 5 && amount.compareTo(deskLimit) <= 0) {
            return ApprovalResult.of(ApprovalTier.DESK_HEAD,
                    String.format(Locale.ROOT, "TRI ≤ 5 AND amount ≤ $%.0fM", millions(deskLimit)));
        }
        if (triScore <= 7 && amount.compareTo(committeeLimit) <= 0) {
            return ApprovalResult.of(ApprovalTier.CREDIT_COMMITTEE,
                    String.format(Locale.ROOT, "TRI ≤ 7 AND amount ≤ $%.0fM", millions(committeeLimit)));
        }
        return ApprovalResult.of(ApprovalTier.BOARD,
                String.format(Locale.ROOT, "TRI > 7 OR amount > $%.0fM", millions(committeeLimit)));
    }

    public List<ComplianceCheck> runComplianceChecks(Counterparty counterparty, Corridor corridor, Hub hub,
                                                     TriResult tri, CapitalValidation capital, RiskConfiguration config) {
        List<ComplianceCheck> checks = new ArrayList<>();

        String cpStatus = label(counterparty.status());
        if (counterparty.status() == CounterpartyStatus.SUSPENDED) {
            checks.add(check("cp", "Counterparty Status", CheckResult.FAIL, counterparty.entity() + " is suspended."));
        } else if (counterparty.status() == CounterpartyStatus.UNDER_REVIEW || counterparty.status() == CounterpartyStatus.PENDING) {
            checks.add(check("cp", "Counterparty Status", CheckResult.WARN, counterparty.entity() + " is " + cpStatus + "."));
        } else {
            checks.add(check("cp", "Counterparty Status", CheckResult.PASS, counterparty.entity() + " is " + cpStatus + "."));
        }

        if (corridor.status() == CorridorStatus.SUSPENDED) {
            checks.add(check("cor", "Corridor Status", CheckResult.FAIL, corridor.name() + " suspended."));
        } else if (corridor.status() == CorridorStatus.RESTRICTED) {
            checks.add(check("cor", "Corridor Status", CheckResult.WARN, corridor.name() + " restricted."));
        } else {
            checks.add(check("cor", "Corridor Status", CheckResult.PASS, corridor.name() + " active."));
        }

        if (hub.status() == HubStatus.OFFLINE) {
            checks.add(check("hub", "Hub Operational", CheckResult.FAIL, hub.name() + " offline."));
        } else if (hub.status() == HubStatus.MAINTENANCE || hub.status() == HubStatus.DEGRADED) {
            checks.add(check("hub", "Hub Operational", CheckResult.WARN, hub.name() + " " + label(hub.status()) + "."));
        } else {
            checks.add(check("hub", "Hub Operational", CheckResult.PASS,
                    hub.name() + " operational (" + number(hub.uptime()) + "%)."));
        }

        double postEcr = capital.postTxnEcr();
        if (postEcr > config.maxEcrRatio()) {
            checks.add(check("ecr", "Capital Adequacy (ECR)", CheckResult.FAIL,
                    String.format(Locale.ROOT, "Post-txn ECR %.2fx > %sx limit.", postEcr, number(config.maxEcrRatio()))));
        } else if (postEcr > config.ecrWarnRatio()) {
            checks.add(check("ecr", "Capital Adequacy (ECR)", CheckResult.WARN,
                    String.format(Locale.ROOT, "Post-txn ECR %.2fx approaching limit.", postEcr)));
        } else {
            checks.add(check("ecr", "Capital Adequacy (ECR)", CheckResult.PASS,
                    String.format(Locale.ROOT, "Post-txn ECR %.2fx within limit.", postEcr)));
        }

        double postUtil = capital.postTxnHardstopUtil();
        if (postUtil > config.hardstopUtilFail()) {
            checks.add(check("hs", "Hardstop Compliance", CheckResult.FAIL,
                    String.format(Locale.ROOT, "Post-txn utilization %.1f%% exceeds limit.", postUtil * 100)));
        } else if (postUtil > config.hardstopUtilWarn()) {
            checks.add(check("hs", "Hardstop Compliance", CheckResult.WARN,
                    String.format(Locale.ROOT, "Post-txn utilization %.1f%% near limit.", postUtil * 100)));
        } else {
            checks.add(check("hs", "Hardstop Compliance", CheckResult.PASS,
                    String.format(Locale.ROOT, "Post-txn utilization %.1f%%.", postUtil * 100)));
        }

        if (tri.score() >= config.triCriticalThreshold()) {
            checks.add(check("tri", "Transaction Risk Index", CheckResult.FAIL,
                    "TRI " + tri.score() + " (Red) - board review required."));
        } else if (tri.score() >= config.triWarnThreshold()) {
            checks.add(check("tri", "Transaction Risk Index", CheckResult.WARN,
                    "TRI " + tri.score() + " (" + label(tri.band()) + ")."));
        } else {
            checks.add(check("tri", "Transaction Risk Index", CheckResult.PASS,
                    "TRI " + tri.score() + " (Green)."));
        }
        return checks;
    }

    public PolicySnapshot evaluate(Counterparty counterparty, Corridor corridor, Hub hub, BigDecimal amount,
                                   CapitalBase capital, RiskConfiguration config, Instant now) {
        TriResult tri = computeTri(counterparty, corridor, amount, capital);
        CapitalValidation validation = validateCapital(amount, capital);
        List<PolicyBlocker> blockers = checkBlockers(counterparty, corridor, hub, tri, amount, capital, config);
        ApprovalResult approval = determineApproval(tri.score(), amount, config);
        List<ComplianceCheck> checks = runComplianceChecks(counterparty, corridor, hub, tri, validation, config);
        return new PolicySnapshot(
                counterparty.id(),
                corridor.id(),
                hub.id(),
                MoneyUtils.scale(amount),
                tri,
                validation,
                approval,
                blockers,
                checks,
                hasBlockLevel(blockers),
                now);
    }

    private static ComplianceCheck check(String id, String name, CheckResult result, String detail) {
        return new ComplianceCheck(id, name, result, detail);
    }

    private static double millions(BigDecimal value) {
        return value.divide(MILLION).doubleValue();
    }

    private static String number(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String label(Enum<?> value) {
        return value == null ? "unknown" : value.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
