package com.aurumshield.backend.policy;

public enum CorridorStatus {
    ACTIVE,
    RESTRICTED,
    SUSPENDED
}
