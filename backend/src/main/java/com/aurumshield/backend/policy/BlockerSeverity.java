package com.aurumshield.backend.policy;

public enum BlockerSeverity {
    BLOCK,
    WARN,
    INFO
}
