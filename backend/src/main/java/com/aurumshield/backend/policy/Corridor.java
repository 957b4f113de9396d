package com.aurumshield.backend.policy;

public record Corridor(String id, String name, RiskLevel riskLevel, CorridorStatus status) {}
