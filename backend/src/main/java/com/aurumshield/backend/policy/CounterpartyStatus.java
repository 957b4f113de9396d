package com.aurumshield.backend.policy;

public enum CounterpartyStatus {
    ACTIVE(0),
    PENDING(2),
    UNDER_REVIEW(4),
    CLOSED(6),
    SUSPENDED(8);

    private final int weight;

    CounterpartyStatus(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
