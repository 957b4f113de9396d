package com.aurumshield.backend.service;

import com.aurumshield.backend.capital.BreachEvent;
import com.aurumshield.backend.capital.CapitalSnapshot;
import com.aurumshield.backend.capital.ControlAction;
import com.aurumshield.backend.capital.ControlMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

@Service
@RequiredArgsConstructor
public class CapitalMetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicReference<Double> ecr = new AtomicReference<>(0.0);
    private final AtomicReference<Double> hardstopUtilization = new AtomicReference<>(0.0);
    private final AtomicReference<Double> controlModeSeverity = new AtomicReference<>(0.0);

    private Counter overridesCreatedCounter;
    private Counter overridesRevokedCounter;
    private Counter overridesExpiredCounter;
    private Counter decisionUnavailableCounter;

    @PostConstruct
    void init() {
        overridesCreatedCounter = Counter.builder("capital_overrides_created_total").register(meterRegistry);
        overridesRevokedCounter = Counter.builder("capital_overrides_revoked_total").register(meterRegistry);
        overridesExpiredCounter = Counter.builder("capital_overrides_expired_total").register(meterRegistry);
        decisionUnavailableCounter = Counter.builder("capital_decision_unavailable_total").register(meterRegistry);
        Gauge.builder("capital_ecr", ecr, value -> value.get()).register(meterRegistry);
        Gauge.builder("capital_hardstop_utilization", hardstopUtilization, value -> value.get()).register(meterRegistry);
        Gauge.builder("capital_control_mode_severity", controlModeSeverity, value -> value.get()).register(meterRegistry);
    }

    public void recordSnapshot(CapitalSnapshot snapshot) {
        ecr.set(snapshot.ecr());
        hardstopUtilization.set(snapshot.hardstopUtilization());
    }

    public void recordMode(ControlMode mode) {
        controlModeSeverity.set((double) mode.severity());
    }

    public void recordBreach(BreachEvent event) {
        Counter.builder("capital_breach_events_total")
                .tag("type", event.type().name())
                .tag("level", event.level().name())
                .register(meterRegistry)
                .increment();
    }

    public void recordBlockedAction(ControlAction action, ControlMode mode) {
        Counter.builder("capital_actions_blocked_total")
                .tag("action", action.name())
                .tag("mode", mode.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordOverrideCreated() {
        if (overridesCreatedCounter != null) {
            overridesCreatedCounter.increment();
        }
    }

    public void recordOverrideRevoked() {
        if (overridesRevokedCounter != null) {
            overridesRevokedCounter.increment();
        }
    }

    public void recordOverridesExpired(int count) {
        if (overridesExpiredCounter != null && count > 0) {
            overridesExpiredCounter.increment(count);
        }
    }

    public void recordDecisionUnavailable() {
        if (decisionUnavailableCounter != null) {
            decisionUnavailableCounter.increment();
        }
    }
}
