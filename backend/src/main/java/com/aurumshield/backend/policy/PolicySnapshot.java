package com.aurumshield.backend.policy;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Everything the policy engine concluded about one proposed transaction, frozen at evaluation time.
 */
public record PolicySnapshot(
        String counterpartyId,
        String corridorId,
        String hubId,
        BigDecimal amount,
        TriResult tri,
        CapitalValidation capital,
        ApprovalResult approval,
        List<PolicyBlocker> blockers,
        List<ComplianceCheck> checks,
        boolean blocked,
        Instant timestamp
) {

    public PolicySnapshot {
        blockers = List.copyOf(blockers);
        checks = List.copyOf(checks);
    }
}
