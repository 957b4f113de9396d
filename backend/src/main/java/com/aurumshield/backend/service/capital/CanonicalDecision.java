package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.BreachEvent;
import com.aurumshield.backend.capital.CapitalSnapshot;
import com.aurumshield.backend.capital.ControlDecision;

import java.util.List;

/**
 * Decision together with the inputs it was computed from. {@code snapshot} is null when the snapshot itself
 * could not be computed and the decision is the fail-safe one.
 */
public record CanonicalDecision(CapitalSnapshot snapshot, ControlDecision decision, List<BreachEvent> breachEvents) {

    public CanonicalDecision {
        breachEvents = breachEvents == null ? List.of() : List.copyOf(breachEvents);
    }
}
