package com.aurumshield.backend.policy;

public enum CheckResult {
    PASS,
    WARN,
    FAIL
}
