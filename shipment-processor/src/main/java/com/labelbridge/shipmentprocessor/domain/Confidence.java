package com.labelbridge.shipmentprocessor.domain;

/**
 * Geocoding confidence, ordered from strongest to weakest.
 */
public enum Confidence {

    HIGH,
    MEDIUM,
    LOW;

    public boolean isAtLeast(Confidence threshold) {
        return ordinal() <= threshold.ordinal();
    }

    /** One level weaker, bottoming out at {@link #LOW}. */
    public Confidence lower() {
        return this == LOW ? LOW : values()[ordinal() + 1];
    }
}
