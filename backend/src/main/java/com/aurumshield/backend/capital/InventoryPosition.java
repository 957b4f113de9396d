package com.aurumshield.backend.capital;

import java.math.BigDecimal;

public record InventoryPosition(
        String id,
        String listingId,
        BigDecimal allocatedWeightOz
) {}
