package com.labelbridge.shipmentprocessor.address;

/**
 * Non-transient answers of the geocoding provider. Transient ones surface as
 * {@link GeocodingUnavailableException}.
 */
public enum GeocodingStatus {
    OK,
    ZERO_RESULTS,
    REQUEST_DENIED,
    INVALID_REQUEST
}
