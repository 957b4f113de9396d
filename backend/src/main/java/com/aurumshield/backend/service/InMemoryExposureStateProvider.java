package com.aurumshield.backend.service;

import com.aurumshield.backend.capital.ExposureState;
import com.aurumshield.backend.capital.Reservation;
import com.aurumshield.backend.capital.ReservationState;
import com.aurumshield.backend.config.CapitalRiskProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the latest exposure state pushed by collaborators. Starts from the configured capital base with no
 * positions. Reservations past their expiry are read as EXPIRED.
 */
@Service
@Slf4j
public class InMemoryExposureStateProvider implements ExposureStateProvider {

    private final AtomicReference<ExposureState> state;

    public InMemoryExposureStateProvider(CapitalRiskProperties properties) {
        this.state = new AtomicReference<>(new ExposureState(
                properties.toCapitalBase(), List.of(), List.of(), List.of(), List.of(), Instant.EPOCH));
    }

    @Override
    public ExposureState currentState(Instant now) {
        ExposureState current = state.get();
        List<Reservation> reservations = current.reservations().stream()
                .map(reservation -> reservation.state() == ReservationState.ACTIVE && !reservation.isActiveAt(now)
                        ? reservation.expired()
                        : reservation)
                .toList();
        return new ExposureState(current.capital(), reservations, current.orders(), current.inventory(),
                current.settlements(), now);
    }

    @Override
    public void replace(ExposureState next) {
        state.set(next);
        log.info("Exposure state replaced: {} reservations, {} orders, {} inventory positions, {} settlements",
                next.reservations().size(), next.orders().size(), next.inventory().size(), next.settlements().size());
    }
}
