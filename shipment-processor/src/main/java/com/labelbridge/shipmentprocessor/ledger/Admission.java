package com.labelbridge.shipmentprocessor.ledger;

/**
 * Answer of {@link DuplicateTracker#admit(String)}.
 *
 * @param admitted       whether the caller now owns the fingerprint for this run
 * @param previousStatus status found in the ledger, {@code null} for a first sighting
 */
public record Admission(boolean admitted, LedgerStatus previousStatus) {

    public static Admission admit(LedgerStatus previousStatus) {
        return new Admission(true, previousStatus);
    }

    public static Admission skip(LedgerStatus previousStatus) {
        return new Admission(false, previousStatus);
    }
}
