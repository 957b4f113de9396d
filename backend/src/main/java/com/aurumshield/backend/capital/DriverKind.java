package com.aurumshield.backend.capital;

public enum DriverKind {
    RESERVATION,
    ORDER,
    SETTLEMENT
}
