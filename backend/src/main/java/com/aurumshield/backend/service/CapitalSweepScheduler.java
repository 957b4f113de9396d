package com.aurumshield.backend.service;

import com.aurumshield.backend.service.capital.BreachSweepResult;
import com.aurumshield.backend.service.capital.CapitalControlService;
import com.aurumshield.backend.service.capital.ControlsSweepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "capital.sweep.enabled", havingValue = "true")
public class CapitalSweepScheduler {

    private final CapitalControlService capitalControlService;

    @Scheduled(fixedDelayString = "${capital.sweep.interval-ms:60000}")
    public void runSweep() {
        Instant now = Instant.now();
        try {
            BreachSweepResult breaches = capitalControlService.runBreachSweep(now);
            if (!breaches.newEvents().isEmpty()) {
                log.warn("Breach sweep recorded {} new events", breaches.newEvents().size());
            }
        } catch (Exception e) {
            log.error("Breach sweep failed", e);
        }
        try {
            ControlsSweepResult controls = capitalControlService.runControlsSweep(now);
            log.debug("Controls sweep: mode={} expiredOverrides={}", controls.decision().mode(),
                    controls.expiredOverrides().size());
        } catch (Exception e) {
            log.error("Controls sweep failed", e);
        }
    }
}
