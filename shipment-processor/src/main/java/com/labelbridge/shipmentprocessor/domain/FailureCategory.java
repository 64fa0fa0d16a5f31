package com.labelbridge.shipmentprocessor.domain;

public enum FailureCategory {

    /** Bad input data: terminal for the row, fixed by hand. */
    DATA_QUALITY,

    /** Geocoding or carrier unreachable: retried, then reported as unresolved. */
    PROVIDER_UNAVAILABLE,

    /** Rejected by the carrier: terminal for the record, carrier message attached. */
    CARRIER_BUSINESS
}
