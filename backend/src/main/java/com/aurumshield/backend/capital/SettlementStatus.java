package com.aurumshield.backend.capital;

import java.util.EnumSet;
import java.util.Set;

public enum SettlementStatus {
    DRAFT,
    ESCROW_OPEN,
    AWAITING_FUNDS,
    AWAITING_GOLD,
    AWAITING_VERIFICATION,
    READY_TO_SETTLE,
    AUTHORIZED,
    PROCESSING_RAIL,
    AMBIGUOUS_STATE,
    SETTLED,
    REVERSED,
    FAILED,
    CANCELLED;

    private static final Set<SettlementStatus> OPEN = EnumSet.of(
            ESCROW_OPEN,
            AWAITING_FUNDS,
            AWAITING_GOLD,
            AWAITING_VERIFICATION,
            READY_TO_SETTLE,
            AUTHORIZED
    );

    /** Statuses whose notional counts toward open settlement exposure. */
    public boolean isOpen() {
        return OPEN.contains(this);
    }
}
