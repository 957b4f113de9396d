package com.aurumshield.backend.capital;

/**
 * Mutating platform actions gated by the capital control mode.
 */
public enum ControlAction {
    CREATE_RESERVATION("Create Reservation"),
    CONVERT_RESERVATION("Convert → Order"),
    PUBLISH_LISTING("Publish Listing"),
    OPEN_SETTLEMENT("Open Settlement"),
    EXECUTE_DVP("Execute DvP");

    private final String label;

    ControlAction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
