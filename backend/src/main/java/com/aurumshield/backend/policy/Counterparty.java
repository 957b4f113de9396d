package com.aurumshield.backend.policy;

public record Counterparty(String id, String entity, RiskLevel riskLevel, CounterpartyStatus status) {}
