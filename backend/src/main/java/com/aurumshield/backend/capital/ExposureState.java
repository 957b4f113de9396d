package com.aurumshield.backend.capital;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate platform state handed to the snapshot calculator. Owned by the marketplace and
 * settlement collaborators; the engine only reads it.
 */
public record ExposureState(
        CapitalBase capital,
        List<Reservation> reservations,
        List<MarketOrder> orders,
        List<InventoryPosition> inventory,
        List<SettlementCase> settlements,
        Instant now
) {

    public ExposureState {
        reservations = reservations == null ? List.of() : List.copyOf(reservations);
        orders = orders == null ? List.of() : List.copyOf(orders);
        inventory = inventory == null ? List.of() : List.copyOf(inventory);
        settlements = settlements == null ? List.of() : List.copyOf(settlements);
    }

    public ExposureState at(Instant instant) {
        return new ExposureState(capital, reservations, orders, inventory, settlements, instant);
    }
}
