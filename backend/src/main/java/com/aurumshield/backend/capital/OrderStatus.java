package com.aurumshield.backend.capital;

public enum OrderStatus {
    DRAFT,
    PENDING_VERIFICATION,
    RESERVED,
    SETTLEMENT_PENDING,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
