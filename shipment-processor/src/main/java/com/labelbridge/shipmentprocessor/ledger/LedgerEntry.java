package com.labelbridge.shipmentprocessor.ledger;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * State of one fingerprint in the upload ledger. One JSON line per transition on disk.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LedgerEntry {

    String fingerprint;
    LedgerStatus status;
    /** Bda reference used for the last submission; the key for status queries. */
    String reference;
    /** Carrier shipment number, once confirmed. */
    String shipmentNumber;
    String failureReason;
    int attempts;
    String sourceId;
    int lineNumber;
    Instant updatedAt;
}
