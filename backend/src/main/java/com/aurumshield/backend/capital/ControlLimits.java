package com.aurumshield.backend.capital;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

/**
 * Advisory caps published alongside a decision; currently only populated while reservations are throttled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ControlLimits(
        BigDecimal maxReservationNotional,
        BigDecimal maxReservationWeightOz
) {

    public static final ControlLimits NONE = new ControlLimits(null, null);
}
