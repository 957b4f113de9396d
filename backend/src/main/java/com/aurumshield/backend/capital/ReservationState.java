package com.aurumshield.backend.capital;

public enum ReservationState {
    ACTIVE,
    EXPIRED,
    CONVERTED
}
