package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.BreachEvent;
import com.aurumshield.backend.capital.CapitalOverride;
import com.aurumshield.backend.capital.CapitalSnapshot;
import com.aurumshield.backend.capital.CapitalSnapshotCalculator;
import com.aurumshield.backend.capital.CapitalThresholds;
import com.aurumshield.backend.capital.ControlDecision;
import com.aurumshield.backend.capital.ControlMode;
import com.aurumshield.backend.capital.ControlModeEvaluator;
import com.aurumshield.backend.capital.EffectiveControlDecision;
import com.aurumshield.backend.capital.OverrideStatus;
import com.aurumshield.backend.config.CapitalRiskProperties;
import com.aurumshield.backend.dto.OverrideView;
import com.aurumshield.backend.service.AuditEventService;
import com.aurumshield.backend.service.AuditRecord;
import com.aurumshield.backend.service.CapitalMetricsService;
import com.aurumshield.backend.service.ExposureStateProvider;
import com.aurumshield.backend.util.Fingerprints;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry points that tie the capital engine to its stores: canonical snapshot and decision, breach and
 * controls sweeps, and the export packets.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CapitalControlService {

    public static final String AUDIT_MODE_CHANGED = "CAPITAL_CONTROL_MODE_CHANGED";

    static final List<String> CAPITAL_AUDIT_ACTIONS = List.of(
            BreachClassifier.AUDIT_ACTION,
            AUDIT_MODE_CHANGED,
            CapitalControlGate.AUDIT_BLOCKED,
            OverrideGovernor.AUDIT_CREATED,
            OverrideGovernor.AUDIT_REVOKED,
            OverrideGovernor.AUDIT_EXPIRED);

    private static final Duration PACKET_BREACH_WINDOW = Duration.ofHours(24);

    private final ExposureStateProvider exposureStateProvider;
    private final CapitalSnapshotCalculator snapshotCalculator;
    private final ControlModeEvaluator controlModeEvaluator;
    private final BreachClassifier breachClassifier;
    private final BreachEventStore breachEventStore;
    private final OverrideGovernor overrideGovernor;
    private final ControlModeStateService controlModeStateService;
    private final AuditEventService auditEventService;
    private final CapitalMetricsService metricsService;
    private final CapitalRiskProperties properties;

    public CapitalThresholds thresholds() {
        return properties.toThresholds();
    }

    public CapitalSnapshot canonicalSnapshot(Instant now) {
        CapitalSnapshot snapshot = snapshotCalculator.compute(exposureStateProvider.currentState(now), thresholds());
        metricsService.recordSnapshot(snapshot);
        return snapshot;
    }

    /**
     * Current control decision. Missing breach history is treated as empty; any other failure yields the
     * fail-safe EMERGENCY_HALT decision rather than an exception.
     */
    public CanonicalDecision canonicalDecision(Instant now) {
        CapitalSnapshot snapshot;
        try {
            snapshot = canonicalSnapshot(now);
        } catch (RuntimeException e) {
            log.error("Capital snapshot unavailable, failing safe", e);
            metricsService.recordDecisionUnavailable();
            return new CanonicalDecision(null, controlModeEvaluator.unavailable(now, e.getMessage()), List.of());
        }
        List<BreachEvent> breachEvents = loadRecentBreaches(now);
        try {
            ControlDecision decision = controlModeEvaluator.evaluate(snapshot, breachEvents, thresholds());
            metricsService.recordMode(decision.mode());
            return new CanonicalDecision(snapshot, decision, breachEvents);
        } catch (RuntimeException e) {
            log.error("Capital control evaluation failed, failing safe", e);
            metricsService.recordDecisionUnavailable();
            return new CanonicalDecision(snapshot, controlModeEvaluator.unavailable(now, e.getMessage()), breachEvents);
        }
    }

    /**
     * Canonical decision with active overrides folded in. If overrides cannot be read the base decision stands.
     */
    public EffectiveControlDecision effectiveDecision(Instant now) {
        return effectiveDecision(canonicalDecision(now).decision(), now);
    }

    public EffectiveControlDecision effectiveDecision(ControlDecision decision, Instant now) {
        List<CapitalOverride> overrides;
        try {
            overrides = overrideGovernor.activeOverrides(now);
        } catch (RuntimeException e) {
            log.warn("Override store unavailable, applying no overrides: {}", e.getMessage());
            overrides = List.of();
        }
        return overrideGovernor.applyOverrides(decision, overrides, now);
    }

    public BreachSweepResult runBreachSweep(Instant now) {
        CapitalSnapshot snapshot = canonicalSnapshot(now);
        List<BreachEvent> existing = loadRecentBreaches(now);
        List<BreachEvent> newEvents = breachClassifier.evaluate(snapshot, existing, thresholds());
        List<BreachEvent> recentEvents = newEvents.isEmpty() ? existing : loadRecentBreaches(now);
        log.debug("Breach sweep at {}: {} new events, {} recent", now, newEvents.size(), recentEvents.size());
        return new BreachSweepResult(snapshot, newEvents, recentEvents);
    }

    /**
     * Recomputes the decision, expires overdue overrides and audits a mode change against the mode the
     * previous sweep recorded.
     */
    public ControlsSweepResult runControlsSweep(Instant now) {
        CanonicalDecision canonical = canonicalDecision(now);
        ControlDecision decision = canonical.decision();
        List<CapitalOverride> expired = overrideGovernor.expireOverrides(now);

        if (!decision.available()) {
            log.error("Controls sweep at {} ran without a decision; mode state left unchanged", now);
            return new ControlsSweepResult(decision, overrideGovernor.listOverrides(now), expired,
                    controlModeStateService.lastKnownMode().orElse(null), false);
        }

        Optional<ControlMode> previous = controlModeStateService.recordMode(decision, now);
        boolean changed = previous.isPresent() && previous.get() != decision.mode();
        if (changed) {
            emitModeChange(previous.get(), canonical, now);
        }
        return new ControlsSweepResult(decision, overrideGovernor.listOverrides(now), expired,
                previous.orElse(null), changed);
    }

    public IntradayPacket exportIntradayPacket(Instant now) {
        CapitalSnapshot snapshot = canonicalSnapshot(now);
        List<BreachEvent> breachEvents = loadBreachHistory();
        IntradayPacket packet = new IntradayPacket(
                IntradayPacket.VERSION,
                now,
                snapshot,
                breachEvents,
                snapshot.topDrivers(),
                auditEventService.eventIdsForActions(List.of(BreachClassifier.AUDIT_ACTION)));
        log.info("Intraday capital packet exported: {} breach events, {} audit ids",
                breachEvents.size(), packet.auditEventIds().size());
        return packet;
    }

    public ControlsPacket exportControlsPacket(Instant now) {
        CanonicalDecision canonical = canonicalDecision(now);
        Instant cutoff = now.minus(PACKET_BREACH_WINDOW);
        List<BreachEvent> recent = canonical.breachEvents().stream()
                .filter(event -> !event.occurredAt().isBefore(cutoff))
                .toList();

        List<CapitalOverride> all = overrideGovernor.listOverrides(now);
        List<OverrideView> overrides = new ArrayList<>();
        all.stream()
                .filter(o -> o.status() == OverrideStatus.ACTIVE)
                .map(OverrideView::from)
                .forEach(overrides::add);
        all.stream()
                .filter(o -> o.status() != OverrideStatus.ACTIVE)
                .sorted(Comparator.comparing(CapitalControlService::closedAt).reversed())
                .limit(properties.getOverrides().getInactiveExportLimit())
                .map(OverrideView::from)
                .forEach(overrides::add);

        ControlsPacket packet = new ControlsPacket(
                ControlsPacket.VERSION,
                now,
                canonical.snapshot(),
                recent,
                canonical.decision(),
                overrides,
                auditEventService.eventIdsForActions(CAPITAL_AUDIT_ACTIONS));
        log.info("Capital controls packet exported: mode={} breaches={} overrides={}",
                canonical.decision().mode(), recent.size(), overrides.size());
        return packet;
    }

    /**
     * Breach events inside the longer of the buffer-negative lookback and the controls packet window.
     */
    List<BreachEvent> loadRecentBreaches(Instant now) {
        Duration lookback = thresholds().bufferNegativeLookback();
        Duration window = lookback.compareTo(PACKET_BREACH_WINDOW) > 0 ? lookback : PACKET_BREACH_WINDOW;
        try {
            return breachEventStore.findSince(now.minus(window));
        } catch (RuntimeException e) {
            log.warn("Breach history unavailable, evaluating with empty history: {}", e.getMessage());
            return List.of();
        }
    }

    private List<BreachEvent> loadBreachHistory() {
        try {
            return breachEventStore.findAll();
        } catch (RuntimeException e) {
            log.warn("Breach history unavailable, evaluating with empty history: {}", e.getMessage());
            return List.of();
        }
    }

    private void emitModeChange(ControlMode previous, CanonicalDecision canonical, Instant now) {
        ControlDecision decision = canonical.decision();
        CapitalSnapshot snapshot = canonical.snapshot();
        String severity = decision.mode() == ControlMode.EMERGENCY_HALT
                ? AuditRecord.SEVERITY_CRITICAL
                : decision.mode() == ControlMode.NORMAL ? AuditRecord.SEVERITY_INFO : AuditRecord.SEVERITY_WARNING;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("previousMode", previous.name());
        metadata.put("newMode", decision.mode().name());
        metadata.put("snapshotHash", decision.snapshotHash());
        metadata.put("breachEventIds", canonical.breachEvents().stream()
                .limit(10)
                .map(BreachEvent::id)
                .collect(Collectors.joining(",")));
        metadata.put("reasons", String.join("; ", decision.reasons()));
        metadata.put("ecr", snapshot.ecr());
        metadata.put("hardstopUtilization", snapshot.hardstopUtilization());

        auditEventService.record(AuditRecord.builder()
                .id("CC-MODE-" + Fingerprints.fingerprint(previous + "-" + decision.mode() + "-" + decision.snapshotHash()))
                .occurredAt(now)
                .actorRole(AuditRecord.SYSTEM_ROLE)
                .action(AUDIT_MODE_CHANGED)
                .resourceType("CAPITAL")
                .resourceId(decision.mode().name())
                .result(AuditRecord.RESULT_SUCCESS)
                .severity(severity)
                .message("Control mode changed: " + previous + " → " + decision.mode())
                .metadata(metadata)
                .build());
        log.warn("Capital control mode changed {} -> {}: {}", previous, decision.mode(), decision.reasons());
    }

    private static Instant closedAt(CapitalOverride override) {
        return override.revokedAt() != null ? override.revokedAt() : override.expiresAt();
    }
}
