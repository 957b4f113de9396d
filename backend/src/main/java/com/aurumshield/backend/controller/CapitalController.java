package com.aurumshield.backend.controller;

import com.aurumshield.backend.capital.BreachEvent;
import com.aurumshield.backend.capital.CapitalSnapshot;
import com.aurumshield.backend.capital.CapitalSnapshotCalculator;
import com.aurumshield.backend.capital.ExposureState;
import com.aurumshield.backend.exception.BadRequestException;
import com.aurumshield.backend.service.ExposureStateProvider;
import com.aurumshield.backend.service.capital.BreachEventStore;
import com.aurumshield.backend.service.capital.BreachSweepResult;
import com.aurumshield.backend.service.capital.CapitalControlService;
import com.aurumshield.backend.service.capital.IntradayPacket;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/capital")
@RequiredArgsConstructor
@Tag(name = "capital")
public class CapitalController {

    private final CapitalControlService capitalControlService;
    private final CapitalSnapshotCalculator snapshotCalculator;
    private final ExposureStateProvider exposureStateProvider;
    private final BreachEventStore breachEventStore;

    @GetMapping("/snapshot")
    @Operation(summary = "Canonical capital snapshot from the current exposure state")
    public ResponseEntity<CapitalSnapshot> getSnapshot() {
        return ResponseEntity.ok(capitalControlService.canonicalSnapshot(Instant.now()));
    }

    @PostMapping("/snapshot")
    @Operation(summary = "Compute a snapshot for the posted exposure state without storing anything")
    public ResponseEntity<CapitalSnapshot> computeSnapshot(@RequestBody ExposureState state) {
        requireCapital(state);
        ExposureState evaluated = state.now() == null ? state.at(Instant.now()) : state;
        return ResponseEntity.ok(snapshotCalculator.compute(evaluated, capitalControlService.thresholds()));
    }

    @PutMapping("/exposure")
    @Operation(summary = "Replace the exposure state the canonical snapshot is computed from")
    public ResponseEntity<CapitalSnapshot> replaceExposure(@RequestBody ExposureState state) {
        requireCapital(state);
        exposureStateProvider.replace(state);
        return ResponseEntity.ok(capitalControlService.canonicalSnapshot(Instant.now()));
    }

    @GetMapping("/breaches")
    @Operation(summary = "All recorded breach events, newest first")
    public ResponseEntity<List<BreachEvent>> getBreaches() {
        return ResponseEntity.ok(breachEventStore.findAll());
    }

    @PostMapping("/breaches/sweep")
    @Operation(summary = "Evaluate the canonical snapshot and record any new breach events")
    public ResponseEntity<BreachSweepResult> runBreachSweep() {
        return ResponseEntity.ok(capitalControlService.runBreachSweep(Instant.now()));
    }

    @GetMapping("/export")
    @Operation(summary = "Intraday capital packet")
    public ResponseEntity<IntradayPacket> exportPacket() {
        return ResponseEntity.ok(capitalControlService.exportIntradayPacket(Instant.now()));
    }

    private static void requireCapital(ExposureState state) {
        if (state == null || state.capital() == null) {
            throw new BadRequestException("Exposure state must include capital figures");
        }
        if (state.capital().capitalBase() == null || state.capital().hardstopLimit() == null
                || state.capital().tvar99() == null) {
            throw new BadRequestException("capitalBase, hardstopLimit and tvar99 are required");
        }
    }
}
