package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.BreachEvent;
import com.aurumshield.backend.capital.BreachEventType;
import com.aurumshield.backend.capital.BreachSeverity;
import com.aurumshield.backend.capital.CapitalSnapshot;
import com.aurumshield.backend.capital.CapitalThresholds;
import com.aurumshield.backend.capital.ExposureDriver;
import com.aurumshield.backend.service.AuditEventService;
import com.aurumshield.backend.service.AuditRecord;
import com.aurumshield.backend.service.CapitalMetricsService;
import com.aurumshield.backend.util.Fingerprints;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a snapshot into breach events. The same condition in the same minute always yields the same id,
 * so re-running a sweep appends nothing new.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BreachClassifier {

    public static final String AUDIT_ACTION = "CAPITAL_BREACH_DETECTED";

    private final BreachEventStore breachEventStore;
    private final AuditEventService auditEventService;
    private final CapitalMetricsService metricsService;

    /**
     * Evaluates every breach condition against {@code snapshot} and appends the ones not already known.
     *
     * @return events appended by this call, in evaluation order
     */
    public List<BreachEvent> evaluate(CapitalSnapshot snapshot, Collection<BreachEvent> existingEvents,
                                      CapitalThresholds thresholds) {
        Set<String> existingIds = existingEvents == null ? Set.of() : existingEvents.stream()
                .map(BreachEvent::id)
                .collect(Collectors.toSet());
        List<BreachEvent> appended = new ArrayList<>();
        for (BreachEvent candidate : detect(snapshot, thresholds)) {
            if (existingIds.contains(candidate.id())) {
                continue;
            }
            if (breachEventStore.appendIfAbsent(candidate)) {
                emitAudit(candidate);
                metricsService.recordBreach(candidate);
                log.warn("Capital breach detected: {} [{}] {}", candidate.type(), candidate.level(), candidate.message());
                appended.add(candidate);
            }
        }
        return appended;
    }

    /**
     * The breach events a snapshot implies, without touching the store.
     */
    public List<BreachEvent> detect(CapitalSnapshot snapshot, CapitalThresholds thresholds) {
        List<BreachEvent> events = new ArrayList<>();
        double ecr = snapshot.ecr();
        double utilization = snapshot.hardstopUtilization();

        if (ecr >= thresholds.ecrCriticalLevel()) {
            events.add(event(snapshot, BreachEventType.ECR_BREACH, BreachSeverity.CRITICAL,
                    String.format(Locale.ROOT, "ECR %.2fx exceeds %.1fx critical threshold (target: %sx)",
                            ecr, thresholds.ecrCriticalLevel(), plain(thresholds.targetEcr()))));
        } else if (ecr >= thresholds.targetEcr()) {
            events.add(event(snapshot, BreachEventType.ECR_CAUTION, BreachSeverity.WARN,
                    String.format(Locale.ROOT, "ECR %.2fx exceeds target %.1fx", ecr, thresholds.targetEcr())));
        }

        if (utilization >= thresholds.hardstopBreach()) {
            events.add(event(snapshot, BreachEventType.HARDSTOP_BREACH, BreachSeverity.CRITICAL,
                    String.format(Locale.ROOT, "Hardstop utilization %.2f%% ≥ %.0f%% - BREACH",
                            utilization * 100, thresholds.hardstopBreach() * 100)));
        } else if (utilization >= thresholds.hardstopCaution()) {
            events.add(event(snapshot, BreachEventType.HARDSTOP_CAUTION, BreachSeverity.WARN,
                    String.format(Locale.ROOT, "Hardstop utilization %.2f%% in %.0f-%.0f%% caution band",
                            utilization * 100, thresholds.hardstopCaution() * 100, thresholds.hardstopBreach() * 100)));
        }

        if (snapshot.bufferVsTvar99().signum() < 0) {
            events.add(event(snapshot, BreachEventType.BUFFER_NEGATIVE, BreachSeverity.WARN,
                    "Buffer vs TVaR99 is negative: -$" + String.format(Locale.US, "%,.0f", snapshot.bufferVsTvar99().abs())));
        }
        return events;
    }

    public static String breachId(BreachEventType type, CapitalSnapshot snapshot) {
        return "brch-" + Fingerprints.fingerprint(
                type.name(),
                Fingerprints.minuteBucket(snapshot.asOf()),
                snapshot.breachLevel().name(),
                Fingerprints.fixed(snapshot.hardstopUtilization(), 4),
                Fingerprints.fixed(snapshot.ecr(), 4));
    }

    private BreachEvent event(CapitalSnapshot snapshot, BreachEventType type, BreachSeverity level, String message) {
        return new BreachEvent(breachId(type, snapshot), snapshot.asOf(), type, level, message, snapshot);
    }

    private void emitAudit(BreachEvent event) {
        String topDriverIds = event.snapshot().topDrivers().stream()
                .map(ExposureDriver::id)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(","));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("breachType", event.type().name());
        metadata.put("hardstopUtilization", round4(event.snapshot().hardstopUtilization()));
        metadata.put("ecr", round4(event.snapshot().ecr()));
        metadata.put("topDriverIds", topDriverIds);
        auditEventService.record(AuditRecord.builder()
                .id("AUD-" + event.id())
                .occurredAt(event.occurredAt())
                .actorRole(AuditRecord.SYSTEM_ROLE)
                .action(AUDIT_ACTION)
                .resourceType("CAPITAL")
                .resourceId(event.id())
                .result(AuditRecord.RESULT_SUCCESS)
                .severity(event.level().auditSeverity())
                .message(event.message())
                .metadata(metadata)
                .build());
    }

    private static double round4(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
