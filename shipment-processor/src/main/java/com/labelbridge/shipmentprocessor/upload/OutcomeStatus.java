package com.labelbridge.shipmentprocessor.upload;

public enum OutcomeStatus {
    ACCEPTED,
    /** Business rejection: never retried. */
    REJECTED,
    /** The carrier could not process the record right now. */
    TEMPORARY_FAILURE
}
