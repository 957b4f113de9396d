package com.aurumshield.backend.capital;

public enum BreachSeverity {
    INFO("info"),
    WARN("warning"),
    CRITICAL("critical");

    private final String auditSeverity;

    BreachSeverity(String auditSeverity) {
        this.auditSeverity = auditSeverity;
    }

    public String auditSeverity() {
        return auditSeverity;
    }
}
