package com.aurumshield.backend.capital;

public enum BreachEventType {
    ECR_CAUTION,
    ECR_BREACH,
    HARDSTOP_CAUTION,
    HARDSTOP_BREACH,
    BUFFER_NEGATIVE
}
