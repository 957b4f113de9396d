package com.aurumshield.backend.policy;

import com.aurumshield.backend.util.MoneyUtils;

import java.math.BigDecimal;

/**
 * Operator-tunable thresholds for transaction policy. Approval limits are held in cents.
 */
public record RiskConfiguration(
        double maxEcrRatio,
        double ecrWarnRatio,
        double hardstopUtilFail,
        double hardstopUtilWarn,
        int triCriticalThreshold,
        int triElevatedThreshold,
        int triWarnThreshold,
        double triConcentrationFactor,
        long autoApprovalLimitCents,
        long deskHeadLimitCents,
        long creditCommitteeLimitCents
) {

    public static final RiskConfiguration DEFAULTS = new RiskConfiguration(
            8,
            7,
            1.0,
            0.9,
            8,
            7,
            5,
            0.5,
            2_500_000_000L,
            5_000_000_000L,
            10_000_000_000L
    );

    public BigDecimal autoApprovalLimit() {
        return MoneyUtils.fromCents(autoApprovalLimitCents);
    }

    public BigDecimal deskHeadLimit() {
        return MoneyUtils.fromCents(deskHeadLimitCents);
    }

    public BigDecimal creditCommitteeLimit() {
        return MoneyUtils.fromCents(creditCommitteeLimitCents);
    }
}
