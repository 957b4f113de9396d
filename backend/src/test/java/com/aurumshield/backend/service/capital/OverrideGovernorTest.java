package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.CapitalOverride;
import com.aurumshield.backend.capital.ControlAction;
import com.aurumshield.backend.capital.ControlDecision;
import com.aurumshield.backend.capital.ControlMode;
import com.aurumshield.backend.capital.ControlModeEvaluator;
import com.aurumshield.backend.capital.EffectiveControlDecision;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.aurumshield.backend.capital.CapitalFixtures.NOW;
import static com.aurumshield.backend.capital.CapitalFixtures.decision;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class OverrideGovernorTest {

    private static final String REASON = "Treasury approved temporary capacity for client settlement";

    private InMemoryCapitalOverrideStore store;
    private AuditEventService auditEventService;
    private CapitalMetricsService metricsService;
    private OverrideGovernor governor;

    @BeforeEach
    void setUp() {
        store = new InMemoryCapitalOverrideStore();
        auditEventService = mock(AuditEventService.class);
        metricsService = mock(CapitalMetricsService.class);
        governor = new OverrideGovernor(store, auditEventService, metricsService, new CapitalRiskProperties());
    }

    @Test
    void actionOverrideClearsOnlyItsOwnBlock() {
        ControlDecision current = decision(ControlMode.FREEZE_CONVERSIONS);
        CapitalOverride override = governor.create(actionRequest(ControlAction.CREATE_RESERVATION), current, NOW)
                .override();

        EffectiveControlDecision effective = governor.applyOverrides(current, governor.activeOverrides(NOW), NOW);

        assertThat(effective.isBlocked(ControlAction.CREATE_RESERVATION)).isFalse();
        assertThat(effective.isBlocked(ControlAction.CONVERT_RESERVATION)).isTrue();
        assertThat(effective.clearedBy()).containsExactlyEntriesOf(
                Map.of(ControlAction.CREATE_RESERVATION, override.id()));
        assertThat(effective.mode()).isEqualTo(ControlMode.FREEZE_CONVERSIONS);
    }

    @Test
    void actionOverrideInThrottleClearsReservationBlock() {
        ControlDecision current = decision(ControlMode.THROTTLE_RESERVATIONS);
        governor.create(actionRequest(ControlAction.CREATE_RESERVATION), current, NOW);

        EffectiveControlDecision effective = governor.applyOverrides(current, governor.activeOverrides(NOW), NOW);

        assertThat(effective.effectiveBlocks().values()).containsOnly(false);
    }

    @Test
    void globalOverrideRelaxesOneLevel() {
        ControlDecision current = decision(ControlMode.FREEZE_CONVERSIONS);
        governor.create(globalRequest(), current, NOW);

        EffectiveControlDecision effective = governor.applyOverrides(current, governor.activeOverrides(NOW), NOW);

        assertThat(effective.isBlocked(ControlAction.CONVERT_RESERVATION)).isFalse();
        assertThat(effective.isBlocked(ControlAction.CREATE_RESERVATION)).isTrue();
        assertThat(effective.appliedOverrideIds()).hasSize(1);
    }

    @Test
    void globalOverrideRejectedInFreezeMarketplace() {
        ControlDecision current = decision(ControlMode.FREEZE_MARKETPLACE);

        assertThatThrownBy(() -> governor.create(globalRequest(), current, NOW))
                .isInstanceOf(OverrideValidationException.class)
                .satisfies(ex -> assertThat(((OverrideValidationException) ex).getViolations())
                        .containsExactly("GLOBAL override not permitted for mode \"FREEZE_MARKETPLACE\". "
                                + "Only allowed for: THROTTLE_RESERVATIONS, FREEZE_CONVERSIONS"));
    }

    @Test
    void globalOverrideRejectedInEmergencyHalt() {
        assertThatThrownBy(() -> governor.create(globalRequest(), decision(ControlMode.EMERGENCY_HALT), NOW))
                .isInstanceOf(OverrideValidationException.class)
                .satisfies(ex -> assertThat(((OverrideValidationException) ex).getViolations())
                        .containsExactly("GLOBAL override not permitted for mode \"EMERGENCY_HALT\". "
                                + "Only allowed for: THROTTLE_RESERVATIONS, FREEZE_CONVERSIONS"));
        assertThat(store.findAll()).isEmpty();
    }

    @Test
    void globalOverrideRejectedInNormal() {
        assertThat(governor.validate(globalRequest(), ControlMode.NORMAL, NOW))
                .containsExactly("GLOBAL override not permitted for mode \"NORMAL\". "
                        + "Only allowed for: THROTTLE_RESERVATIONS, FREEZE_CONVERSIONS");
    }

    @Test
    void creationRejectedWhileDecisionUnavailable() {
        ControlDecision unavailable = new ControlModeEvaluator().unavailable(NOW, "ledger offline");

        assertThatThrownBy(() -> governor.create(actionRequest(ControlAction.OPEN_SETTLEMENT), unavailable, NOW))
                .isInstanceOf(OverrideValidationException.class)
                .satisfies(ex -> assertThat(((OverrideValidationException) ex).getViolations())
                        .containsExactly(OverrideGovernor.DECISION_UNAVAILABLE_MESSAGE));
        assertThat(store.findAll()).isEmpty();
    }

    @Test
    void everyViolationIsReported() {
        CreateOverrideRequest request = actionRequest(ControlAction.PUBLISH_LISTING);
        request.setReason("too short");
        request.setExpiresAt(NOW.minusSeconds(1));

        assertThatThrownBy(() -> governor.create(request, decision(ControlMode.FREEZE_MARKETPLACE), NOW))
                .isInstanceOf(OverrideValidationException.class)
                .satisfies(ex -> assertThat(((OverrideValidationException) ex).getViolations())
                        .containsExactly("Reason must be at least 20 characters (got 9)",
                                "expiresAt must be in the future"));
    }

    @Test
    void actionScopeRequiresActionKey() {
        CreateOverrideRequest request = actionRequest(null);

        assertThat(governor.validate(request, ControlMode.FREEZE_MARKETPLACE, NOW))
                .containsExactly("ACTION-scoped override must specify an actionKey");
    }

    @Test
    void unauthorizedRoleIsForbidden() {
        CreateOverrideRequest request = actionRequest(ControlAction.CREATE_RESERVATION);
        request.setActorRole("trader");

        assertThatThrownBy(() -> governor.create(request, decision(ControlMode.THROTTLE_RESERVATIONS), NOW))
                .isInstanceOf(ForbiddenActionException.class)
                .hasMessageContaining("Role \"trader\" is not authorized to create overrides");
        assertThat(store.findAll()).isEmpty();
    }

    @Test
    void repeatedSubmissionInSameMinuteReturnsExistingOverride() {
        ControlDecision current = decision(ControlMode.THROTTLE_RESERVATIONS);

        OverrideCreationResult first = governor.create(actionRequest(ControlAction.CREATE_RESERVATION), current, NOW);
        OverrideCreationResult second = governor.create(actionRequest(ControlAction.CREATE_RESERVATION), current,
                NOW.plusSeconds(20));

        assertThat(first.isNew()).isTrue();
        assertThat(second.isNew()).isFalse();
        assertThat(second.override().id()).isEqualTo(first.override().id())
                .isEqualTo("OVR-u-42-2026-02-17T02:30-CREATE_RESERVATION");
        assertThat(store.findAll()).hasSize(1);
        verify(auditEventService, times(1)).record(any(AuditRecord.class));
        verify(metricsService, times(1)).recordOverrideCreated();
    }

    @Test
    void overrideRecordsDecisionItWasCreatedUnder() {
        ControlDecision current = decision(ControlMode.THROTTLE_RESERVATIONS);

        CapitalOverride override = governor.create(actionRequest(ControlAction.CREATE_RESERVATION), current, NOW)
                .override();

        assertThat(override.modeAtCreation()).isEqualTo(ControlMode.THROTTLE_RESERVATIONS);
        assertThat(override.snapshotHash()).isEqualTo(current.snapshotHash());
        assertThat(override.actorRole()).isEqualTo("treasury");
        assertThat(override.status()).isEqualTo(OverrideStatus.ACTIVE);
    }

    @Test
    void overrideDoesNotCarryIntoMoreSevereMode() {
        governor.create(actionRequest(ControlAction.CREATE_RESERVATION), decision(ControlMode.THROTTLE_RESERVATIONS),
                NOW);
        ControlDecision escalated = decision(ControlMode.FREEZE_MARKETPLACE);

        EffectiveControlDecision effective = governor.applyOverrides(escalated, governor.activeOverrides(NOW), NOW);

        assertThat(effective.isBlocked(ControlAction.CREATE_RESERVATION)).isTrue();
        assertThat(effective.appliedOverrideIds()).isEmpty();
    }

    @Test
    void failSafeDecisionIsNeverRelaxed() {
        governor.create(actionRequest(ControlAction.EXECUTE_DVP), decision(ControlMode.EMERGENCY_HALT), NOW);
        ControlDecision unavailable = new ControlModeEvaluator().unavailable(NOW, "boom");

        EffectiveControlDecision effective = governor.applyOverrides(unavailable, governor.activeOverrides(NOW), NOW);

        assertThat(effective.effectiveBlocks().values()).containsOnly(true);
    }

    @Test
    void revokeMovesActiveOverrideToRevokedOnce() {
        CapitalOverride override = governor.create(actionRequest(ControlAction.CREATE_RESERVATION),
                decision(ControlMode.THROTTLE_RESERVATIONS), NOW).override();
        RevokeOverrideRequest revoke = new RevokeOverrideRequest("Compliance", "u-7");

        CapitalOverride revoked = governor.revoke(override.id(), revoke, NOW.plusSeconds(60));

        assertThat(revoked.status()).isEqualTo(OverrideStatus.REVOKED);
        assertThat(revoked.revokedBy()).isEqualTo("u-7");
        assertThat(revoked.revokedAt()).isEqualTo(NOW.plusSeconds(60));
        assertThatThrownBy(() -> governor.revoke(override.id(), revoke, NOW.plusSeconds(90)))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("status: REVOKED");
        verify(metricsService, times(1)).recordOverrideRevoked();
    }

    @Test
    void revokeUnknownOverrideIsNotFound() {
        assertThatThrownBy(() -> governor.revoke("OVR-missing", new RevokeOverrideRequest("admin", "u-1"), NOW))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void revokeOfExpiredOverrideConflicts() {
        CapitalOverride override = governor.create(actionRequest(ControlAction.CREATE_RESERVATION),
                decision(ControlMode.THROTTLE_RESERVATIONS), NOW).override();

        assertThatThrownBy(() -> governor.revoke(override.id(), new RevokeOverrideRequest("admin", "u-1"),
                NOW.plus(Duration.ofHours(3))))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("status: EXPIRED");
    }

    @Test
    void expiredOverridesAreFlippedAndAuditedOnce() {
        CapitalOverride override = governor.create(actionRequest(ControlAction.CREATE_RESERVATION),
                decision(ControlMode.THROTTLE_RESERVATIONS), NOW).override();
        Instant later = override.expiresAt().plusSeconds(1);

        assertThat(governor.activeOverrides(later)).isEmpty();
        assertThat(governor.listOverrides(later)).singleElement()
                .extracting(CapitalOverride::status).isEqualTo(OverrideStatus.EXPIRED);

        List<CapitalOverride> expired = governor.expireOverrides(later);
        assertThat(expired).extracting(CapitalOverride::id).containsExactly(override.id());
        assertThat(governor.expireOverrides(later)).isEmpty();
        assertThat(store.findById(override.id())).get()
                .extracting(CapitalOverride::status).isEqualTo(OverrideStatus.EXPIRED);

        ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditEventService, times(2)).record(captor.capture());
        assertThat(captor.getAllValues()).extracting(AuditRecord::action)
                .containsExactly(OverrideGovernor.AUDIT_CREATED, OverrideGovernor.AUDIT_EXPIRED);
    }

    private static CreateOverrideRequest actionRequest(ControlAction action) {
        return CreateOverrideRequest.builder()
                .scope(OverrideScopeType.ACTION)
                .actionKey(action)
                .reason(REASON)
                .expiresAt(NOW.plus(Duration.ofHours(2)))
                .actorRole("Treasury")
                .actorUserId("u-42")
                .actorName("Desk Treasurer")
                .build();
    }

    private static CreateOverrideRequest globalRequest() {
        CreateOverrideRequest request = actionRequest(null);
        request.setScope(OverrideScopeType.GLOBAL);
        return request;
    }
}
