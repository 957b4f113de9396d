package com.aurumshield.backend.service;

import com.aurumshield.backend.capital.ExposureState;

import java.time.Instant;

/**
 * Source of the platform exposure the capital engine evaluates. Implementations own the
 * reservation, order, inventory and settlement records; the engine only reads them.
 */
public interface ExposureStateProvider {

    /**
     * Current exposure state as seen at {@code now}.
     */
    ExposureState currentState(Instant now);

    /**
     * Replaces the held exposure state. Read-only providers may reject this.
     */
    void replace(ExposureState state);
}
