package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.BreachEvent;
import com.aurumshield.backend.capital.CapitalSnapshot;

import java.util.List;

public record BreachSweepResult(CapitalSnapshot snapshot, List<BreachEvent> newEvents, List<BreachEvent> recentEvents) {}
