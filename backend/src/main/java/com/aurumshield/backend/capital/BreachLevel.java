package com.aurumshield.backend.capital;

public enum BreachLevel {
    CLEAR,
    CAUTION,
    BREACH
}
