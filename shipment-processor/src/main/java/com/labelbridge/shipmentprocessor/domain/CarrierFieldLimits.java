package com.labelbridge.shipmentprocessor.domain;

/**
 * Maximum field lengths accepted by the carrier label service.
 */
public final class CarrierFieldLimits {

    public static final int RECIPIENT = 35;
    public static final int STREET = 35;
    public static final int LOCALITY = 30;
    public static final int NOTES = 40;

    /** Hard ceiling on records per submission. */
    public static final int MAX_BATCH_SIZE = 400;

    private CarrierFieldLimits() {
    }
}
