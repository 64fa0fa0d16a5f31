package com.labelbridge.shipmentprocessor.address;

/**
 * Transient geocoding failure: timeout, I/O error, 5xx, quota exceeded.
 */
public class GeocodingUnavailableException extends RuntimeException {

    public GeocodingUnavailableException(String message) {
        super(message);
    }

    public GeocodingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
