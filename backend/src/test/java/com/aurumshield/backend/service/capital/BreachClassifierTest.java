package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.BreachEvent;
import com.aurumshield.backend.capital.BreachEventType;
import com.aurumshield.backend.capital.BreachLevel;
import com.aurumshield.backend.capital.BreachSeverity;
import com.aurumshield.backend.capital.CapitalFixtures;
import com.aurumshield.backend.capital.CapitalSnapshot;
import com.aurumshield.backend.capital.CapitalSnapshotCalculator;
import com.aurumshield.backend.capital.CapitalThresholds;
import com.aurumshield.backend.service.AuditEventService;
import com.aurumshield.backend.service.AuditRecord;
import com.aurumshield.backend.service.CapitalMetricsService;
import com.aurumshield.backend.util.MoneyUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class BreachClassifierTest {

    private final CapitalSnapshotCalculator calculator = new CapitalSnapshotCalculator();

    private InMemoryBreachEventStore store;
    private AuditEventService auditEventService;
    private CapitalMetricsService metricsService;
    private BreachClassifier classifier;

    @BeforeEach
    void setUp() {
        store = new InMemoryBreachEventStore();
        auditEventService = mock(AuditEventService.class);
        metricsService = mock(CapitalMetricsService.class);
        classifier = new BreachClassifier(store, auditEventService, metricsService);
    }

    @Test
    void hardstopBreachIsRecordedOnceWithDeterministicId() {
        CapitalSnapshot snapshot = snapshotAt(49_000_000);

        List<BreachEvent> first = classifier.evaluate(snapshot, store.findAll(), CapitalThresholds.DEFAULTS);
        List<BreachEvent> second = classifier.evaluate(snapshot, store.findAll(), CapitalThresholds.DEFAULTS);

        assertThat(first).singleElement().satisfies(event -> {
            assertThat(event.type()).isEqualTo(BreachEventType.HARDSTOP_BREACH);
            assertThat(event.level()).isEqualTo(BreachSeverity.CRITICAL);
            assertThat(event.id()).isEqualTo(BreachClassifier.breachId(BreachEventType.HARDSTOP_BREACH, snapshot));
            assertThat(event.message()).contains("98.00%").endsWith("BREACH");
        });
        assertThat(second).isEmpty();
        assertThat(store.findAll()).hasSize(1);
        verify(auditEventService, times(1)).record(any(AuditRecord.class));
        verify(metricsService, times(1)).recordBreach(any(BreachEvent.class));
    }

    @Test
    void auditRecordCarriesBreachMetadata() {
        CapitalSnapshot snapshot = snapshotAt(49_000_000);

        BreachEvent event = classifier.evaluate(snapshot, List.of(), CapitalThresholds.DEFAULTS).get(0);

        ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditEventService).record(captor.capture());
        AuditRecord record = captor.getValue();
        assertThat(record.id()).isEqualTo("AUD-" + event.id());
        assertThat(record.action()).isEqualTo(BreachClassifier.AUDIT_ACTION);
        assertThat(record.severity()).isEqualTo(AuditRecord.SEVERITY_CRITICAL);
        assertThat(record.metadata())
                .containsEntry("breachType", "HARDSTOP_BREACH")
                .containsEntry("hardstopUtilization", 0.98)
                .containsEntry("topDriverIds", "stl-1");
    }

    @Test
    void cautionBandProducesWarnEvent() {
        List<BreachEvent> events = classifier.detect(snapshotAt(42_000_000), CapitalThresholds.DEFAULTS);

        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.type()).isEqualTo(BreachEventType.HARDSTOP_CAUTION);
            assertThat(event.level()).isEqualTo(BreachSeverity.WARN);
        });
    }

    @Test
    void clearSnapshotProducesNothing() {
        assertThat(classifier.evaluate(snapshotAt(10_000_000), List.of(), CapitalThresholds.DEFAULTS)).isEmpty();
        verify(auditEventService, never()).record(any(AuditRecord.class));
    }

    @Test
    void ecrAboveCriticalLevelIsEcrBreach() {
        CapitalSnapshot snapshot = CapitalFixtures.snapshot(9.8, 0.5, BreachLevel.CAUTION,
                MoneyUtils.bd(25_000_000), List.of());

        List<BreachEvent> events = classifier.detect(snapshot, CapitalThresholds.DEFAULTS);

        assertThat(events).extracting(BreachEvent::type).containsExactly(BreachEventType.ECR_BREACH);
        assertThat(events.get(0).message()).isEqualTo("ECR 9.80x exceeds 9.6x critical threshold (target: 8x)");
    }

    @Test
    void eventAlreadyInHistoryIsNotAppendedAgain() {
        CapitalSnapshot snapshot = snapshotAt(49_000_000);
        List<BreachEvent> known = classifier.detect(snapshot, CapitalThresholds.DEFAULTS);

        assertThat(classifier.evaluate(snapshot, known, CapitalThresholds.DEFAULTS)).isEmpty();
        assertThat(store.findAll()).isEmpty();
    }

    private CapitalSnapshot snapshotAt(long grossExposure) {
        return calculator.compute(CapitalFixtures.stateWithOpenSettlement(MoneyUtils.bd(grossExposure)),
                CapitalThresholds.DEFAULTS);
    }
}
