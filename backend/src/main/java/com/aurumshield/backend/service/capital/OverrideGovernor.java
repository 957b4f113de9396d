package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.CapitalOverride;
import com.aurumshield.backend.capital.ControlAction;
import com.aurumshield.backend.capital.ControlDecision;
import com.aurumshield.backend.capital.ControlMode;
import com.aurumshield.backend.capital.EffectiveControlDecision;
import com.aurumshield.backend.capital.OverrideScope;
import com.aurumshield.backend.capital.OverrideScopeType;
import com.aurumshield.backend.capital.OverrideStatus;
import com.aurumshield.backend.config.CapitalRiskProperties;
import com.aurumshield.backend.dto.CreateOverrideRequest;
import com.aurumshield.backend.dto.RevokeOverrideRequest;
import com.aurumshield.backend.exception.ConflictException;
import com.aurumshield.backend.exception.ForbiddenActionException;
import com.aurumshield.backend.exception.NotFoundException;
import com.aurumshield.backend.exception.OverrideValidationException;
import com.aurumshield.backend.service.AuditEventService;
import com.aurumshield.backend.service.AuditRecord;
import com.aurumshield.backend.service.CapitalMetricsService;
import com.aurumshield.backend.util.Fingerprints;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Creates, revokes and expires capital overrides, and folds active ones into a control decision.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OverrideGovernor {

    public static final String AUDIT_CREATED = "CAPITAL_OVERRIDE_CREATED";
    public static final String AUDIT_REVOKED = "CAPITAL_OVERRIDE_REVOKED";
    public static final String AUDIT_EXPIRED = "CAPITAL_OVERRIDE_EXPIRED";
    public static final String DECISION_UNAVAILABLE_MESSAGE =
            "Capital control decision unavailable; overrides cannot be created until it is restored";

    private final CapitalOverrideStore overrideStore;
    private final AuditEventService auditEventService;
    private final CapitalMetricsService metricsService;
    private final CapitalRiskProperties properties;

    /**
     * Every rule the request breaks under {@code currentMode}. Empty means the request is acceptable.
     */
    public List<String> validate(CreateOverrideRequest request, ControlMode currentMode, Instant now) {
        List<String> errors = new ArrayList<>();
        if (!isAuthorized(request.getActorRole())) {
            errors.add(unauthorizedMessage(request.getActorRole(), "create overrides"));
        }

        int minLength = properties.getOverrides().getMinReasonLength();
        int reasonLength = request.getReason() == null ? 0 : request.getReason().trim().length();
        if (reasonLength < minLength) {
            errors.add("Reason must be at least " + minLength + " characters (got " + reasonLength + ")");
        }

        if (request.getExpiresAt() == null || !request.getExpiresAt().isAfter(now)) {
            errors.add("expiresAt must be in the future");
        }

        if (request.getScope() == OverrideScopeType.GLOBAL && !currentMode.isGloballyOverridable()) {
            errors.add("GLOBAL override not permitted for mode \"" + currentMode + "\". Only allowed for: "
                    + globallyOverridableModes());
        }
        if (request.getScope() == OverrideScopeType.ACTION && request.getActionKey() == null) {
            errors.add("ACTION-scoped override must specify an actionKey");
        }
        return errors;
    }

    /**
     * Creates an override against the decision currently in force. The id is derived from the actor, the
     * minute and the action, so a repeated submission returns the first override instead of a second one.
     */
    public OverrideCreationResult create(CreateOverrideRequest request, ControlDecision current, Instant now) {
        List<String> errors = validate(request, current.mode(), now);
        if (!current.available()) {
            errors.add(DECISION_UNAVAILABLE_MESSAGE);
        }
        if (!isAuthorized(request.getActorRole())) {
            throw new ForbiddenActionException(String.join("; ", errors));
        }
        if (!errors.isEmpty()) {
            throw new OverrideValidationException(errors);
        }

        OverrideScope scope = request.getScope() == OverrideScopeType.GLOBAL
                ? OverrideScope.global()
                : OverrideScope.action(request.getActionKey());
        String id = overrideId(request.getActorUserId(), now, scope);
        CapitalOverride candidate = new CapitalOverride(
                id,
                scope,
                request.getReason().trim(),
                now,
                request.getExpiresAt(),
                OverrideStatus.ACTIVE,
                normalizeRole(request.getActorRole()),
                request.getActorUserId(),
                request.getActorName(),
                null,
                null,
                current.snapshotHash(),
                current.mode());

        if (!overrideStore.insertIfAbsent(candidate)) {
            CapitalOverride existing = overrideStore.findById(id)
                    .orElseThrow(() -> new ConflictException("Override " + id + " could not be created"));
            log.info("Override {} already exists, returning existing record", id);
            return new OverrideCreationResult(existing, false);
        }

        auditEventService.record(AuditRecord.builder()
                .id("CC-OVR-C-" + Fingerprints.fingerprint(id))
                .occurredAt(now)
                .actorRole(candidate.actorRole())
                .actorUserId(candidate.actorUserId())
                .action(AUDIT_CREATED)
                .resourceType("CAPITAL")
                .resourceId(id)
                .result(AuditRecord.RESULT_SUCCESS)
                .severity(AuditRecord.SEVERITY_WARNING)
                .message("Override " + id + " created: scope=" + scope.type() + " action="
                        + actionLabel(scope) + " mode=" + current.mode())
                .metadata(Map.of(
                        "overrideId", id,
                        "scope", scope.type().name(),
                        "actionKey", actionLabel(scope),
                        "reason", truncate(candidate.reason(), 100),
                        "modeAtCreation", current.mode().name(),
                        "snapshotHash", String.valueOf(current.snapshotHash()),
                        "expiresAt", candidate.expiresAt().toString()))
                .build());
        metricsService.recordOverrideCreated();
        log.warn("Capital override {} created by {} ({}) under mode {}", id, candidate.actorUserId(),
                candidate.actorRole(), current.mode());
        return new OverrideCreationResult(candidate, true);
    }

    public CapitalOverride revoke(String overrideId, RevokeOverrideRequest request, Instant now) {
        if (!isAuthorized(request.getActorRole())) {
            throw new ForbiddenActionException(unauthorizedMessage(request.getActorRole(), "revoke overrides"));
        }
        CapitalOverride existing = overrideStore.findById(overrideId)
                .orElseThrow(() -> new NotFoundException("Override not found: " + overrideId));
        OverrideStatus effective = existing.effectiveStatus(now);
        if (effective != OverrideStatus.ACTIVE) {
            throw new ConflictException("Override " + overrideId + " is not active (status: " + effective + ")");
        }
        if (!overrideStore.compareAndSetStatus(overrideId, OverrideStatus.ACTIVE, OverrideStatus.REVOKED,
                now, request.getActorUserId())) {
            OverrideStatus latest = overrideStore.findById(overrideId)
                    .map(o -> o.effectiveStatus(now))
                    .orElse(OverrideStatus.EXPIRED);
            throw new ConflictException("Override " + overrideId + " is not active (status: " + latest + ")");
        }

        String role = normalizeRole(request.getActorRole());
        auditEventService.record(AuditRecord.builder()
                .id("CC-OVR-R-" + Fingerprints.fingerprint(overrideId + Fingerprints.minuteBucket(now)))
                .occurredAt(now)
                .actorRole(role)
                .actorUserId(request.getActorUserId())
                .action(AUDIT_REVOKED)
                .resourceType("CAPITAL")
                .resourceId(overrideId)
                .result(AuditRecord.RESULT_SUCCESS)
                .severity(AuditRecord.SEVERITY_INFO)
                .message("Override " + overrideId + " revoked by " + role)
                .metadata(Map.of("overrideId", overrideId, "revokedBy", request.getActorUserId()))
                .build());
        metricsService.recordOverrideRevoked();
        log.info("Capital override {} revoked by {}", overrideId, request.getActorUserId());
        return overrideStore.findById(overrideId)
                .orElseGet(() -> existing.withStatus(OverrideStatus.REVOKED, now, request.getActorUserId()));
    }

    /**
     * Flips stored ACTIVE overrides past their expiry to EXPIRED.
     *
     * @return overrides this call expired
     */
    public List<CapitalOverride> expireOverrides(Instant now) {
        List<CapitalOverride> expired = new ArrayList<>();
        for (CapitalOverride candidate : overrideStore.findExpiredButActive(now)) {
            if (!overrideStore.compareAndSetStatus(candidate.id(), OverrideStatus.ACTIVE, OverrideStatus.EXPIRED,
                    now, null)) {
                continue;
            }
            CapitalOverride result = candidate.withStatus(OverrideStatus.EXPIRED, now, null);
            expired.add(result);
            auditEventService.record(AuditRecord.builder()
                    .id("CC-OVR-E-" + Fingerprints.fingerprint(candidate.id()))
                    .occurredAt(now)
                    .actorRole(AuditRecord.SYSTEM_ROLE)
                    .action(AUDIT_EXPIRED)
                    .resourceType("CAPITAL")
                    .resourceId(candidate.id())
                    .result(AuditRecord.RESULT_SUCCESS)
                    .severity(AuditRecord.SEVERITY_INFO)
                    .message("Override " + candidate.id() + " expired at " + candidate.expiresAt())
                    .metadata(Map.of("overrideId", candidate.id(), "expiresAt", candidate.expiresAt().toString()))
                    .build());
        }
        if (!expired.isEmpty()) {
            metricsService.recordOverridesExpired(expired.size());
            log.info("Expired {} capital overrides", expired.size());
        }
        return expired;
    }

    /**
     * All overrides with expiry applied to their status, newest first.
     */
    public List<CapitalOverride> listOverrides(Instant now) {
        return overrideStore.findAll().stream()
                .map(o -> o.effectiveStatus(now) == o.status() ? o : o.withStatus(o.effectiveStatus(now), now, null))
                .toList();
    }

    public List<CapitalOverride> activeOverrides(Instant now) {
        return overrideStore.findAll().stream()
                .filter(o -> o.isActiveAt(now))
                .toList();
    }

    /**
     * Folds active overrides into {@code decision}. An override created under a less severe mode than the
     * current one no longer applies. ACTION overrides clear their own action; a GLOBAL override relaxes the
     * block matrix to that of the next lower mode, and only while the current mode allows GLOBAL overrides.
     * A fail-safe decision is never relaxed.
     */
    public EffectiveControlDecision applyOverrides(ControlDecision decision, Collection<CapitalOverride> overrides,
                                                   Instant now) {
        if (!decision.available() || overrides == null || overrides.isEmpty()) {
            return EffectiveControlDecision.unchanged(decision);
        }
        ControlMode mode = decision.mode();
        Map<ControlAction, Boolean> effective = new EnumMap<>(decision.blocks());
        Map<ControlAction, String> clearedBy = new EnumMap<>(ControlAction.class);
        Set<String> applied = new LinkedHashSet<>();

        List<CapitalOverride> usable = overrides.stream()
                .filter(o -> o.isActiveAt(now))
                .filter(o -> !mode.isMoreSevereThan(o.modeAtCreation()))
                .toList();

        if (mode.isGloballyOverridable()) {
            usable.stream().filter(CapitalOverride::isGlobal).findFirst().ifPresent(global -> {
                Map<ControlAction, Boolean> relaxed = mode.oneLevelDown().blockMatrix();
                for (ControlAction action : ControlAction.values()) {
                    if (Boolean.TRUE.equals(effective.get(action)) && !Boolean.TRUE.equals(relaxed.get(action))) {
                        effective.put(action, false);
                        clearedBy.put(action, global.id());
                        applied.add(global.id());
                    }
                }
            });
        }

        for (CapitalOverride override : usable) {
            ControlAction action = override.scope().actionKey();
            if (action != null && Boolean.TRUE.equals(effective.get(action))) {
                effective.put(action, false);
                clearedBy.put(action, override.id());
                applied.add(override.id());
            }
        }
        return new EffectiveControlDecision(decision, effective, clearedBy, new ArrayList<>(applied));
    }

    public boolean isAuthorized(String role) {
        return role != null && properties.allowedOverrideRoles().contains(normalizeRole(role));
    }

    static String overrideId(String actorUserId, Instant now, OverrideScope scope) {
        String suffix = scope.actionKey() == null ? "" : "-" + scope.actionKey().name();
        return "OVR-" + actorUserId + "-" + Fingerprints.minuteBucket(now) + suffix;
    }

    private String unauthorizedMessage(String role, String what) {
        return "Role \"" + role + "\" is not authorized to " + what + ". Allowed: "
                + String.join(", ", properties.allowedOverrideRoles());
    }

    private static String globallyOverridableModes() {
        return Arrays.stream(ControlMode.values())
                .filter(ControlMode::isGloballyOverridable)
                .map(Enum::name)
                .collect(Collectors.joining(", "));
    }

    private static String normalizeRole(String role) {
        return role == null ? null : role.trim().toLowerCase(Locale.ROOT);
    }

    private static String actionLabel(OverrideScope scope) {
        return scope.actionKey() == null ? "ALL" : scope.actionKey().name();
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
