package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.CapitalOverride;
import com.aurumshield.backend.capital.OverrideStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

class InMemoryCapitalOverrideStore implements CapitalOverrideStore {

    private final Map<String, CapitalOverride> overrides = new LinkedHashMap<>();

    @Override
    public synchronized Optional<CapitalOverride> findById(String id) {
        return Optional.ofNullable(overrides.get(id));
    }

    @Override
    public synchronized boolean insertIfAbsent(CapitalOverride override) {
        return overrides.putIfAbsent(override.id(), override) == null;
    }

    @Override
    public synchronized List<CapitalOverride> findAll() {
        return overrides.values().stream()
                .sorted(Comparator.comparing(CapitalOverride::createdAt).reversed())
                .toList();
    }

    @Override
    public synchronized List<CapitalOverride> findExpiredButActive(Instant now) {
        return overrides.values().stream()
                .filter(o -> o.status() == OverrideStatus.ACTIVE && !o.expiresAt().isAfter(now))
                .toList();
    }

    @Override
    public synchronized boolean compareAndSetStatus(String id, OverrideStatus expected, OverrideStatus next,
                                                    Instant at, String by) {
        CapitalOverride current = overrides.get(id);
        if (current == null || current.status() != expected) {
            return false;
        }
        if (next == OverrideStatus.REVOKED && !current.expiresAt().isAfter(at)) {
            return false;
        }
        overrides.put(id, current.withStatus(next, at, by));
        return true;
    }
}
