package com.labelbridge.shipmentprocessor.upload;

/**
 * Carrier answer for one submitted record.
 */
public record CarrierOutcome(String reference, String shipmentNumber, OutcomeStatus status, String errorCode,
                             String message) {

    public String describe() {
        if (errorCode == null) {
            return message;
        }
        return message == null ? errorCode : errorCode + ": " + message;
    }
}
