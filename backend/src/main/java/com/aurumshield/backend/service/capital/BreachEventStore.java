package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.BreachEvent;

import java.time.Instant;
import java.util.List;

/**
 * Append-only breach history keyed by content id.
 */
public interface BreachEventStore {

    /**
     * Appends the event unless an event with the same id is already stored.
     *
     * @return true if this call stored the event
     */
    boolean appendIfAbsent(BreachEvent event);

    /** All events, newest first. */
    List<BreachEvent> findAll();

    /** Events that occurred at or after {@code since}, newest first. */
    List<BreachEvent> findSince(Instant since);
}
