package com.aurumshield.backend.policy;

public record PolicyBlocker(String id, BlockerSeverity severity, String title, String detail) {

    public boolean isBlocking() {
        return severity == BlockerSeverity.BLOCK;
    }
}
