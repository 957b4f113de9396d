package com.aurumshield.backend.capital;

import java.math.BigDecimal;

public record ExposureDriver(
        DriverKind kind,
        String label,
        BigDecimal value,
        String id
) {}
