package com.aurumshield.backend.policy;

public enum ApprovalTier {
    AUTO("Auto-Approved"),
    DESK_HEAD("Desk Head"),
    CREDIT_COMMITTEE("Credit Committee"),
    BOARD("Board Approval");

    private final String label;

    ApprovalTier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
