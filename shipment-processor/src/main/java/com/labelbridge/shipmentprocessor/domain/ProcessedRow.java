package com.labelbridge.shipmentprocessor.domain;

/**
 * Output of the preparation step for one row: exactly one of the two components is set.
 */
public record ProcessedRow(PreparedShipment prepared, RejectedRow rejected) {

    public static ProcessedRow prepared(PreparedShipment prepared) {
        return new ProcessedRow(prepared, null);
    }

    public static ProcessedRow rejected(RejectedRow rejected) {
        return new ProcessedRow(null, rejected);
    }

    public boolean isPrepared() {
        return prepared != null;
    }
}
