package com.aurumshield.backend.capital;

import java.math.BigDecimal;
import java.time.Instant;

public record SettlementCase(
        String id,
        String orderId,
        BigDecimal weightOz,
        BigDecimal notionalUsd,
        SettlementStatus status,
        Instant updatedAt
) {}
