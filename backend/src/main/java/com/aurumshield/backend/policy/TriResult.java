package com.aurumshield.backend.policy;

/**
 * Transaction Risk Index. {@code formula} spells out every factor so the score can be replayed from an audit log.
 */
public record TriResult(
        int score,
        TriBand band,
        TriComponent counterpartyRisk,
        TriComponent corridorRisk,
        TriComponent amountConcentration,
        TriComponent counterpartyStatus,
        double rawScore,
        String formula
) {}
