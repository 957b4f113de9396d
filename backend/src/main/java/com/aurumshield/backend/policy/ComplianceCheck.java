package com.aurumshield.backend.policy;

public record ComplianceCheck(String id, String name, CheckResult result, String detail) {}
