package com.aurumshield.backend.capital;

public enum OverrideStatus {
    ACTIVE,
    EXPIRED,
    REVOKED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
