package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.BreachEventType;
import com.aurumshield.backend.capital.CapitalFixtures;
import com.aurumshield.backend.capital.CapitalSnapshotCalculator;
import com.aurumshield.backend.capital.ControlAction;
import com.aurumshield.backend.capital.ControlDecision;
import com.aurumshield.backend.capital.ControlMode;
import com.aurumshield.backend.capital.ControlModeEvaluator;
import com.aurumshield.backend.capital.EffectiveControlDecision;
import com.aurumshield.backend.capital.OverrideScopeType;
import com.aurumshield.backend.config.CapitalRiskProperties;
import com.aurumshield.backend.dto.CreateOverrideRequest;
import com.aurumshield.backend.service.AuditEventService;
import com.aurumshield.backend.service.AuditRecord;
import com.aurumshield.backend.service.CapitalMetricsService;
import com.aurumshield.backend.service.ExposureStateProvider;
import com.aurumshield.backend.service.InMemoryExposureStateProvider;
import com.aurumshield.backend.util.MoneyUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.aurumshield.backend.capital.CapitalFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CapitalControlServiceTest {

    private final CapitalRiskProperties properties = new CapitalRiskProperties();

    private InMemoryExposureStateProvider exposureStateProvider;
    private InMemoryBreachEventStore breachEventStore;
    private InMemoryCapitalOverrideStore overrideStore;
    private ControlModeStateService controlModeStateService;
    private AuditEventService auditEventService;
    private CapitalMetricsService metricsService;

    @BeforeEach
    void setUp() {
        exposureStateProvider = new InMemoryExposureStateProvider(properties);
        breachEventStore = new InMemoryBreachEventStore();
        overrideStore = new InMemoryCapitalOverrideStore();
        controlModeStateService = mock(ControlModeStateService.class);
        auditEventService = mock(AuditEventService.class);
        metricsService = mock(CapitalMetricsService.class);
    }

    @Test
    void coldStartIsNormal() {
        CanonicalDecision canonical = service().canonicalDecision(NOW);

        assertThat(canonical.decision().mode()).isEqualTo(ControlMode.NORMAL);
        assertThat(canonical.snapshot().grossExposureNotional()).isEqualByComparingTo("0");
    }

    @Test
    void snapshotFailureYieldsFailSafeDecision() {
        ExposureStateProvider broken = mock(ExposureStateProvider.class);
        when(broken.currentState(any(Instant.class))).thenThrow(new IllegalStateException("ledger offline"));

        CanonicalDecision canonical = service(broken, breachEventStore).canonicalDecision(NOW);

        assertThat(canonical.snapshot()).isNull();
        assertThat(canonical.decision().mode()).isEqualTo(ControlMode.EMERGENCY_HALT);
        assertThat(canonical.decision().available()).isFalse();
        assertThat(canonical.decision().reasons()).contains(ControlModeEvaluator.UNAVAILABLE_REASON);
        verify(metricsService).recordDecisionUnavailable();
    }

    @Test
    void breachHistoryFailureEvaluatesWithEmptyHistory() {
        BreachEventStore broken = mock(BreachEventStore.class);
        when(broken.findSince(any(Instant.class))).thenThrow(new IllegalStateException("table locked"));
        exposureStateProvider.replace(CapitalFixtures.stateWithOpenSettlement(MoneyUtils.bd(49_000_000)));

        CanonicalDecision canonical = service(exposureStateProvider, broken).canonicalDecision(NOW);

        assertThat(canonical.decision().available()).isTrue();
        assertThat(canonical.decision().mode()).isEqualTo(ControlMode.FREEZE_MARKETPLACE);
        assertThat(canonical.breachEvents()).isEmpty();
    }

    @Test
    void decisionReadsOnlyTheRecentBreachWindow() {
        BreachEventStore store = mock(BreachEventStore.class);
        when(store.findSince(any(Instant.class))).thenReturn(List.of());

        service(exposureStateProvider, store).canonicalDecision(NOW);

        verify(store).findSince(NOW.minus(Duration.ofHours(24)));
        verify(store, never()).findAll();
    }

    @Test
    void breachSweepAppendsOnlyOncePerMinute() {
        exposureStateProvider.replace(CapitalFixtures.stateWithOpenSettlement(MoneyUtils.bd(49_000_000)));
        CapitalControlService service = service();

        BreachSweepResult first = service.runBreachSweep(NOW);
        BreachSweepResult second = service.runBreachSweep(NOW.plusSeconds(10));

        assertThat(first.newEvents()).extracting(event -> event.type()).containsExactly(BreachEventType.HARDSTOP_BREACH);
        assertThat(second.newEvents()).isEmpty();
        assertThat(second.recentEvents()).hasSize(1);
    }

    @Test
    void controlsSweepAuditsModeChange() {
        exposureStateProvider.replace(CapitalFixtures.stateWithOpenSettlement(MoneyUtils.bd(49_000_000)));
        when(controlModeStateService.recordMode(any(ControlDecision.class), any(Instant.class)))
                .thenReturn(Optional.of(ControlMode.NORMAL));

        ControlsSweepResult result = service().runControlsSweep(NOW);

        assertThat(result.modeChanged()).isTrue();
        assertThat(result.previousMode()).isEqualTo(ControlMode.NORMAL);
        ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditEventService).record(captor.capture());
        AuditRecord record = captor.getValue();
        assertThat(record.action()).isEqualTo(CapitalControlService.AUDIT_MODE_CHANGED);
        assertThat(record.id()).startsWith("CC-MODE-");
        assertThat(record.metadata())
                .containsEntry("previousMode", "NORMAL")
                .containsEntry("newMode", "FREEZE_MARKETPLACE");
    }

    @Test
    void controlsSweepWithoutChangeDoesNotAudit() {
        when(controlModeStateService.recordMode(any(ControlDecision.class), any(Instant.class)))
                .thenReturn(Optional.of(ControlMode.NORMAL));

        ControlsSweepResult result = service().runControlsSweep(NOW);

        assertThat(result.modeChanged()).isFalse();
        verify(auditEventService, never()).record(any(AuditRecord.class));
    }

    @Test
    void failSafeSweepLeavesModeStateAlone() {
        ExposureStateProvider broken = mock(ExposureStateProvider.class);
        when(broken.currentState(any(Instant.class))).thenThrow(new IllegalStateException("ledger offline"));

        ControlsSweepResult result = service(broken, breachEventStore).runControlsSweep(NOW);

        assertThat(result.decision().available()).isFalse();
        verify(controlModeStateService, never()).recordMode(any(ControlDecision.class), any(Instant.class));
    }

    @Test
    void overrideStoreFailureAppliesNoOverrides() {
        CapitalOverrideStore broken = mock(CapitalOverrideStore.class);
        when(broken.findAll()).thenThrow(new IllegalStateException("timeout"));
        exposureStateProvider.replace(CapitalFixtures.stateWithOpenSettlement(MoneyUtils.bd(47_000_000)));
        OverrideGovernor governor = new OverrideGovernor(broken, auditEventService, metricsService, properties);

        EffectiveControlDecision effective = service(exposureStateProvider, breachEventStore, governor)
                .effectiveDecision(NOW);

        assertThat(effective.mode()).isEqualTo(ControlMode.FREEZE_CONVERSIONS);
        assertThat(effective.appliedOverrideIds()).isEmpty();
    }

    @Test
    void controlsPacketListsRecentBreachesAndOverrides() {
        exposureStateProvider.replace(CapitalFixtures.stateWithOpenSettlement(MoneyUtils.bd(47_000_000)));
        CapitalControlService service = service();
        service.runBreachSweep(NOW.minus(Duration.ofHours(30)));
        service.runBreachSweep(NOW);
        OverrideGovernor governor = governor();
        governor.create(CreateOverrideRequest.builder()
                .scope(OverrideScopeType.ACTION)
                .actionKey(ControlAction.CREATE_RESERVATION)
                .reason("Client settlement window approved by treasury")
                .expiresAt(NOW.plus(Duration.ofHours(1)))
                .actorRole("treasury")
                .actorUserId("u-9")
                .build(), service.canonicalDecision(NOW).decision(), NOW);
        when(auditEventService.eventIdsForActions(CapitalControlService.CAPITAL_AUDIT_ACTIONS))
                .thenReturn(List.of("CC-OVR-C-1"));

        ControlsPacket packet = service.exportControlsPacket(NOW);

        assertThat(packet.packetVersion()).isEqualTo(ControlsPacket.VERSION);
        assertThat(packet.breachEvents()).hasSize(1);
        assertThat(packet.controlDecision().mode()).isEqualTo(ControlMode.FREEZE_CONVERSIONS);
        assertThat(packet.overrides()).singleElement()
                .satisfies(view -> assertThat(view.actionKey()).isEqualTo(ControlAction.CREATE_RESERVATION));
        assertThat(packet.auditEventIds()).containsExactly("CC-OVR-C-1");
    }

    private CapitalControlService service() {
        return service(exposureStateProvider, breachEventStore);
    }

    private CapitalControlService service(ExposureStateProvider provider, BreachEventStore store) {
        return service(provider, store, governor());
    }

    private CapitalControlService service(ExposureStateProvider provider, BreachEventStore store,
                                          OverrideGovernor governor) {
        BreachClassifier classifier = new BreachClassifier(store, auditEventService, metricsService);
        return new CapitalControlService(provider, new CapitalSnapshotCalculator(), new ControlModeEvaluator(),
                classifier, store, governor, controlModeStateService, auditEventService, metricsService, properties);
    }

    private OverrideGovernor governor() {
        return new OverrideGovernor(overrideStore, auditEventService, metricsService, properties);
    }
}
