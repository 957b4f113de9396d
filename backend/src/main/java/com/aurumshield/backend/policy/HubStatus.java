package com.aurumshield.backend.policy;

public enum HubStatus {
    OPERATIONAL,
    DEGRADED,
    MAINTENANCE,
    OFFLINE
}
