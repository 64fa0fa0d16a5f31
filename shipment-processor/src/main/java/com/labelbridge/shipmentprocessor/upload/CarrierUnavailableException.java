package com.labelbridge.shipmentprocessor.upload;

/**
 * Transient carrier failure: timeout, connection error, 5xx, or records left without a final outcome.
 */
public class CarrierUnavailableException extends RuntimeException {

    public CarrierUnavailableException(String message) {
        super(message);
    }

    public CarrierUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
