package com.aurumshield.backend.controller;

import com.aurumshield.backend.dto.RiskConfigUpdateRequest;
import com.aurumshield.backend.policy.RiskConfiguration;
import com.aurumshield.backend.service.RiskConfigurationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/risk-config")
@RequiredArgsConstructor
@Tag(name = "policy")
public class RiskConfigController {

    private final RiskConfigurationService riskConfigurationService;

    @GetMapping
    @Operation(summary = "Active risk configuration")
    public ResponseEntity<RiskConfiguration> getConfig() {
        return ResponseEntity.ok(riskConfigurationService.getActiveConfig());
    }

    @PutMapping
    @Operation(summary = "Replace the active risk configuration")
    public ResponseEntity<RiskConfiguration> updateConfig(@Valid @RequestBody RiskConfigUpdateRequest request) {
        return ResponseEntity.ok(riskConfigurationService.update(request, Instant.now()));
    }
}
