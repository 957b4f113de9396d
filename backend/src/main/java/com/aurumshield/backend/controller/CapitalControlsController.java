package com.aurumshield.backend.controller;

import com.aurumshield.backend.capital.ControlAction;
import com.aurumshield.backend.capital.ControlDecision;
import com.aurumshield.backend.capital.ControlLimits;
import com.aurumshield.backend.capital.ControlMode;
import com.aurumshield.backend.capital.EffectiveControlDecision;
import com.aurumshield.backend.dto.CreateOverrideRequest;
import com.aurumshield.backend.dto.OverrideView;
import com.aurumshield.backend.dto.RevokeOverrideRequest;
import com.aurumshield.backend.service.capital.CapitalControlGate;
import com.aurumshield.backend.service.capital.CapitalControlService;
import com.aurumshield.backend.service.capital.ControlsPacket;
import com.aurumshield.backend.service.capital.ControlsSweepResult;
import com.aurumshield.backend.service.capital.OverrideCreationResult;
import com.aurumshield.backend.service.capital.OverrideGovernor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/capital-controls")
@RequiredArgsConstructor
@Tag(name = "capital-controls")
public class CapitalControlsController {

    private final CapitalControlService capitalControlService;
    private final OverrideGovernor overrideGovernor;
    private final CapitalControlGate capitalControlGate;

    @GetMapping
    @Operation(summary = "Current control decision with active overrides applied")
    public ResponseEntity<ControlStateResponse> getControls() {
        return ResponseEntity.ok(ControlStateResponse.from(capitalControlService.effectiveDecision(Instant.now())));
    }

    @GetMapping("/overrides")
    @Operation(summary = "All overrides, with overdue ones reported as EXPIRED")
    public ResponseEntity<List<OverrideView>> getOverrides() {
        return ResponseEntity.ok(overrideGovernor.listOverrides(Instant.now()).stream()
                .map(OverrideView::from)
                .toList());
    }

    @PostMapping("/overrides")
    @Operation(summary = "Create a time-boxed override")
    @ApiResponse(responseCode = "201", description = "Override created")
    @ApiResponse(responseCode = "200", description = "Same override already created this minute")
    public ResponseEntity<OverrideView> createOverride(@Valid @RequestBody CreateOverrideRequest request) {
        Instant now = Instant.now();
        ControlDecision current = capitalControlService.canonicalDecision(now).decision();
        OverrideCreationResult result = overrideGovernor.create(request, current, now);
        return ResponseEntity.status(result.isNew() ? HttpStatus.CREATED : HttpStatus.OK)
                .body(OverrideView.from(result.override()));
    }

    @PostMapping("/overrides/{id}/revoke")
    @Operation(summary = "Revoke an active override")
    public ResponseEntity<OverrideView> revokeOverride(@PathVariable String id,
                                                       @Valid @RequestBody RevokeOverrideRequest request) {
        return ResponseEntity.ok(OverrideView.from(overrideGovernor.revoke(id, request, Instant.now())));
    }

    @PostMapping("/sweep")
    @Operation(summary = "Recompute the decision, expire overdue overrides and record mode changes")
    public ResponseEntity<SweepResponse> runSweep() {
        ControlsSweepResult result = capitalControlService.runControlsSweep(Instant.now());
        return ResponseEntity.ok(new SweepResponse(
                result.decision().mode(),
                result.previousMode(),
                result.modeChanged(),
                result.expiredOverrides().stream().map(OverrideView::from).toList(),
                result.overrides().stream().map(OverrideView::from).toList()));
    }

    @PostMapping("/check/{action}")
    @Operation(summary = "Gate check for a mutating action")
    @ApiResponse(responseCode = "423", description = "Action blocked by the current control mode")
    public ResponseEntity<CapitalControlGate.GateResult> checkAction(
            @PathVariable ControlAction action,
            @RequestParam(required = false) String actorRole,
            @RequestParam(required = false) String actorUserId) {
        return ResponseEntity.ok(capitalControlGate.check(action, actorRole, actorUserId, Instant.now()));
    }

    @GetMapping("/export")
    @Operation(summary = "Capital controls packet")
    public ResponseEntity<ControlsPacket> exportPacket() {
        return ResponseEntity.ok(capitalControlService.exportControlsPacket(Instant.now()));
    }

    public record ControlStateResponse(
            Instant asOf,
            ControlMode mode,
            List<String> reasons,
            Map<ControlAction, Boolean> blocks,
            Map<ControlAction, Boolean> effectiveBlocks,
            Map<ControlAction, String> clearedBy,
            List<String> appliedOverrideIds,
            ControlLimits limits,
            String snapshotHash,
            boolean available
    ) {

        static ControlStateResponse from(EffectiveControlDecision effective) {
            ControlDecision decision = effective.decision();
            return new ControlStateResponse(
                    decision.asOf(),
                    decision.mode(),
                    decision.reasons(),
                    decision.blocks(),
                    effective.effectiveBlocks(),
                    effective.clearedBy(),
                    effective.appliedOverrideIds(),
                    decision.limits(),
                    decision.snapshotHash(),
                    decision.available());
        }
    }

    public record SweepResponse(
            ControlMode mode,
            ControlMode previousMode,
            boolean modeChanged,
            List<OverrideView> expiredOverrides,
            List<OverrideView> overrides
    ) {}
}
