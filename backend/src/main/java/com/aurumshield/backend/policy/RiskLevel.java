package com.aurumshield.backend.policy;

public enum RiskLevel {
    LOW(1),
    MEDIUM(3),
    HIGH(6),
    CRITICAL(9);

    private final int weight;

    RiskLevel(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
