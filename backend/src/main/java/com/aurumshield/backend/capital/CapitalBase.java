package com.aurumshield.backend.capital;

import java.math.BigDecimal;

/**
 * Capital figures supplied by the treasury side: the capital base, the absolute exposure
 * ceiling, the externally computed TVaR99 and the currently booked exposure.
 */
public record CapitalBase(
        BigDecimal capitalBase,
        BigDecimal hardstopLimit,
        BigDecimal tvar99,
        BigDecimal activeExposure
) {}
