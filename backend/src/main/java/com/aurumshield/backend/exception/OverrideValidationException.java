package com.aurumshield.backend.exception;

import java.util.List;

/**
 * Override request rejected. Carries every rule the request broke, not just the first.
 */
public class OverrideValidationException extends BadRequestException {

    private final List<String> violations;

    public OverrideValidationException(List<String> violations) {
        super("Override validation failed: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
