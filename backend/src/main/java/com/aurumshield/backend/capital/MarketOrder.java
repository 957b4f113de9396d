package com.aurumshield.backend.capital;

import java.math.BigDecimal;

public record MarketOrder(
        String id,
        String listingId,
        BigDecimal weightOz,
        BigDecimal pricePerOz,
        BigDecimal notional,
        OrderStatus status
) {}
