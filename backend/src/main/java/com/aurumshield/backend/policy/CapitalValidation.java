package com.aurumshield.backend.policy;

import java.math.BigDecimal;

public record CapitalValidation(
        BigDecimal currentExposure,
        BigDecimal postTxnExposure,
        BigDecimal capitalBase,
        double currentEcr,
        double postTxnEcr,
        BigDecimal hardstopLimit,
        double currentHardstopUtil,
        double postTxnHardstopUtil,
        BigDecimal hardstopRemaining
) {}
