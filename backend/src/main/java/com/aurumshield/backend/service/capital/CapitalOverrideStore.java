package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.CapitalOverride;
import com.aurumshield.backend.capital.OverrideStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Override persistence. Status changes go through {@link #compareAndSetStatus} so concurrent revoke and
 * expiry calls have exactly one winner.
 */
public interface CapitalOverrideStore {

    Optional<CapitalOverride> findById(String id);

    /**
     * @return true if this call stored the override, false if the id already existed
     */
    boolean insertIfAbsent(CapitalOverride override);

    /** All overrides with stored status, newest first. */
    List<CapitalOverride> findAll();

    /** Stored-ACTIVE overrides whose expiry is at or before {@code now}. */
    List<CapitalOverride> findExpiredButActive(Instant now);

    /**
     * Moves {@code id} from {@code expected} to {@code next}. For REVOKED, {@code at} and {@code by} are
     * recorded and the override must not yet have expired at {@code at}.
     *
     * @return true if this call made the transition
     */
    boolean compareAndSetStatus(String id, OverrideStatus expected, OverrideStatus next, Instant at, String by);
}
