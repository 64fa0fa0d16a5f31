package com.labelbridge.shipmentprocessor.address;

/**
 * External geocoding authority.
 */
public interface GeocodingProvider {

    /**
     * @throws GeocodingUnavailableException on transient failures, which callers may retry
     */
    GeocodingCandidate geocode(AddressQuery query);
}
