package com.aurumshield.backend.capital;

import java.math.BigDecimal;
import java.time.Instant;

public record Reservation(
        String id,
        String listingId,
        BigDecimal weightOz,
        BigDecimal pricePerOzLocked,
        Instant expiresAt,
        ReservationState state
) {

    public boolean isActiveAt(Instant now) {
        if (state != ReservationState.ACTIVE) {
            return false;
        }
        return expiresAt == null || now.isBefore(expiresAt);
    }

    public Reservation expired() {
        return new Reservation(id, listingId, weightOz, pricePerOzLocked, expiresAt, ReservationState.EXPIRED);
    }
}
