package com.labelbridge.shipmentprocessor.ledger;

public enum LedgerStatus {
    /** Admitted in this run, not yet sent. Never persisted. */
    PENDING,
    /** Persisted before the network call; outcome not yet known. */
    SUBMITTED,
    CONFIRMED,
    /** Terminal for the run that recorded it; may be admitted again by a later run. */
    FAILED
}
