package com.aurumshield.backend.policy;

public record Hub(String id, String name, HubStatus status, double uptime) {}
