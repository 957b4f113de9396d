package com.aurumshield.backend.policy;

public record ApprovalResult(ApprovalTier tier, String label, String reason) {

    static ApprovalResult of(ApprovalTier tier, String reason) {
        return new ApprovalResult(tier, tier.label(), reason);
    }
}
