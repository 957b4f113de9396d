package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.ControlAction;
import com.aurumshield.backend.capital.ControlDecision;
import com.aurumshield.backend.capital.ControlMode;
import com.aurumshield.backend.capital.EffectiveControlDecision;
import com.aurumshield.backend.exception.CapitalControlBlockedException;
import com.aurumshield.backend.service.AuditEventService;
import com.aurumshield.backend.service.AuditRecord;
import com.aurumshield.backend.service.CapitalMetricsService;
import com.aurumshield.backend.util.Fingerprints;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Guard called before every mutating marketplace or settlement action.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CapitalControlGate {

    public static final String AUDIT_BLOCKED = "CAPITAL_CONTROL_BLOCKED";

    private final CapitalControlService capitalControlService;
    private final AuditEventService auditEventService;
    private final CapitalMetricsService metricsService;

    /**
     * Passes when the action is not blocked or an active override clears it, otherwise audits the denial and
     * throws {@link CapitalControlBlockedException}.
     */
    public GateResult check(ControlAction action, String actorRole, String actorUserId, Instant now) {
        ControlDecision decision = capitalControlService.canonicalDecision(now).decision();
        if (!decision.isBlocked(action)) {
            return new GateResult(action, decision.mode(), true, null);
        }

        EffectiveControlDecision effective = capitalControlService.effectiveDecision(decision, now);
        if (effective.isOverridden(action)) {
            String overrideId = effective.clearedBy().get(action);
            audit(action, decision, actorRole, actorUserId, now, overrideId);
            log.info("Action {} allowed under mode {} by override {}", action, decision.mode(), overrideId);
            return new GateResult(action, decision.mode(), true, overrideId);
        }

        audit(action, decision, actorRole, actorUserId, now, null);
        metricsService.recordBlockedAction(action, decision.mode());
        log.warn("Action {} blocked under mode {} for actor {}", action, decision.mode(), actorUserId);
        throw new CapitalControlBlockedException(action, decision.mode(), decision.reasons());
    }

    private void audit(ControlAction action, ControlDecision decision, String actorRole, String actorUserId,
                       Instant now, String overrideId) {
        boolean overrideApplied = overrideId != null;
        String actor = actorUserId == null ? "anon" : actorUserId;
        String dedupKey = action + "-" + decision.mode() + "-" + Fingerprints.minuteBucket(now) + "-" + actor
                + (overrideApplied ? "-" + overrideId : "");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("actionKey", action.name());
        metadata.put("mode", decision.mode().name());
        metadata.put("snapshotHash", String.valueOf(decision.snapshotHash()));
        metadata.put("reasons", String.join("; ", decision.reasons()));
        metadata.put("overrideApplied", overrideApplied);
        if (overrideApplied) {
            metadata.put("overrideId", overrideId);
        }

        auditEventService.record(AuditRecord.builder()
                .id((overrideApplied ? "CC-OVR-USE-" : "CC-BLOCK-") + Fingerprints.fingerprint(dedupKey))
                .occurredAt(now)
                .actorRole(actorRole == null ? AuditRecord.SYSTEM_ROLE : actorRole)
                .actorUserId(actorUserId)
                .action(AUDIT_BLOCKED)
                .resourceType("CAPITAL")
                .resourceId(action.name())
                .result(overrideApplied ? AuditRecord.RESULT_SUCCESS : AuditRecord.RESULT_DENIED)
                .severity(decision.mode() == ControlMode.EMERGENCY_HALT
                        ? AuditRecord.SEVERITY_CRITICAL
                        : AuditRecord.SEVERITY_WARNING)
                .message(overrideApplied
                        ? "Action " + action + " allowed by override " + overrideId + " under capital control mode " + decision.mode()
                        : "Action " + action + " blocked by capital control mode " + decision.mode())
                .metadata(metadata)
                .build());
    }

    /**
     * @param overrideId override that let the action through, null if it was never blocked
     */
    public record GateResult(ControlAction action, ControlMode mode, boolean allowed, String overrideId) {}
}
