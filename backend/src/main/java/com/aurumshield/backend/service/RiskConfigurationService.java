package com.aurumshield.backend.service;

import com.aurumshield.backend.config.CapitalRiskProperties;
import com.aurumshield.backend.dto.RiskConfigUpdateRequest;
import com.aurumshield.backend.exception.BadRequestException;
import com.aurumshield.backend.exception.ForbiddenActionException;
import com.aurumshield.backend.model.GlobalRiskParameters;
import com.aurumshield.backend.policy.RiskConfiguration;
import com.aurumshield.backend.repository.GlobalRiskParametersRepository;
import com.aurumshield.backend.util.Fingerprints;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Serves the active {@link RiskConfiguration} from {@code global_risk_parameters} through a short TTL cache.
 * When the table cannot be read the last good value is served, or the compiled-in defaults if there is none.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RiskConfigurationService {

    private final GlobalRiskParametersRepository repository;
    private final CapitalRiskProperties properties;
    private final AuditEventService auditEventService;

    private volatile CachedConfig cached;

    public RiskConfiguration getActiveConfig() {
        return getActiveConfig(Instant.now());
    }

    public RiskConfiguration getActiveConfig(Instant now) {
        CachedConfig current = cached;
        Duration ttl = properties.getRiskConfig().getCacheTtl();
        if (current != null && now.isBefore(current.loadedAt().plus(ttl))) {
            return current.config();
        }
        try {
            RiskConfiguration loaded = repository.findFirstByActiveTrueOrderByUpdatedAtDesc()
                    .map(RiskConfigurationService::toConfig)
                    .orElseGet(() -> {
                        log.warn("No active risk parameters row, using defaults");
                        return RiskConfiguration.DEFAULTS;
                    });
            cached = new CachedConfig(loaded, now);
            return loaded;
        } catch (Exception e) {
            log.error("Risk configuration fetch failed, using {}", current != null ? "cached value" : "defaults", e);
            return current != null ? current.config() : RiskConfiguration.DEFAULTS;
        }
    }

    public void invalidate() {
        cached = null;
    }

    @Transactional
    public RiskConfiguration update(RiskConfigUpdateRequest request, Instant now) {
        String role = request.getActorRole().trim().toLowerCase(Locale.ROOT);
        if (!properties.allowedOverrideRoles().contains(role)) {
            throw new ForbiddenActionException("Role \"" + request.getActorRole()
                    + "\" is not authorized to change risk parameters. Allowed: "
                    + String.join(", ", properties.allowedOverrideRoles()));
        }
        List<String> problems = new ArrayList<>();
        if (request.getEcrWarnRatio() > request.getMaxEcrRatio()) {
            problems.add("ecrWarnRatio must not exceed maxEcrRatio");
        }
        if (request.getHardstopUtilWarn() > request.getHardstopUtilFail()) {
            problems.add("hardstopUtilWarn must not exceed hardstopUtilFail");
        }
        if (request.getAutoApprovalLimitCents() > request.getDeskHeadLimitCents()
                || request.getDeskHeadLimitCents() > request.getCreditCommitteeLimitCents()) {
            problems.add("approval limits must be ascending: auto <= desk head <= credit committee");
        }
        if (!problems.isEmpty()) {
            throw new BadRequestException(String.join("; ", problems));
        }

        repository.findAll().stream()
                .filter(GlobalRiskParameters::isActive)
                .forEach(row -> {
                    row.setActive(false);
                    repository.save(row);
                });
        GlobalRiskParameters saved = repository.save(GlobalRiskParameters.builder()
                .active(true)
                .maxEcrRatio(request.getMaxEcrRatio())
                .ecrWarnRatio(request.getEcrWarnRatio())
                .hardstopUtilFail(request.getHardstopUtilFail())
                .hardstopUtilWarn(request.getHardstopUtilWarn())
                .triCriticalThreshold(request.getTriCriticalThreshold())
                .triElevatedThreshold(request.getTriElevatedThreshold())
                .triWarnThreshold(request.getTriWarnThreshold())
                .triConcentrationFactor(request.getTriConcentrationFactor())
                .autoApprovalLimitCents(request.getAutoApprovalLimitCents())
                .deskHeadLimitCents(request.getDeskHeadLimitCents())
                .creditCommitteeLimitCents(request.getCreditCommitteeLimitCents())
                .updatedBy(request.getActorUserId())
                .updatedAt(now)
                .build());
        invalidate();

        RiskConfiguration config = toConfig(saved);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("configuration", config);
        auditEventService.record(AuditRecord.builder()
                .id("RISK-CFG-" + Fingerprints.fingerprint(request.getActorUserId(), Fingerprints.minuteBucket(now),
                        config.toString()))
                .occurredAt(now)
                .actorRole(role)
                .actorUserId(request.getActorUserId())
                .action("RISK_CONFIG_UPDATED")
                .resourceType("RISK_CONFIGURATION")
                .resourceId(String.valueOf(saved.getId()))
                .result(AuditRecord.RESULT_SUCCESS)
                .severity(AuditRecord.SEVERITY_WARNING)
                .message("Risk parameters updated by " + request.getActorUserId())
                .metadata(metadata)
                .build());
        log.info("Risk parameters updated by {} ({})", request.getActorUserId(), role);
        return config;
    }

    static RiskConfiguration toConfig(GlobalRiskParameters row) {
        return new RiskConfiguration(
                row.getMaxEcrRatio(),
                row.getEcrWarnRatio(),
                row.getHardstopUtilFail(),
                row.getHardstopUtilWarn(),
                row.getTriCriticalThreshold(),
                row.getTriElevatedThreshold(),
                row.getTriWarnThreshold(),
                row.getTriConcentrationFactor(),
                row.getAutoApprovalLimitCents(),
                row.getDeskHeadLimitCents(),
                row.getCreditCommitteeLimitCents());
    }

    private record CachedConfig(RiskConfiguration config, Instant loadedAt) {}
}
