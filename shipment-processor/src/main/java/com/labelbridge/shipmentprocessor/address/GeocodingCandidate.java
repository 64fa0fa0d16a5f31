package com.labelbridge.shipmentprocessor.address;

import com.labelbridge.shipmentprocessor.domain.Confidence;
import lombok.Builder;

/**
 * Best candidate returned by the geocoding provider.
 *
 * @param route        street name without number, {@code null} for area-level matches
 * @param streetNumber house number, {@code null} when not resolved
 * @param locality     municipality
 * @param province     province short name ({@code "MI"})
 * @param postalCode   postal code as returned, not yet validated
 * @param ambiguous    provider returned several candidates that disagree
 */
@Builder
public record GeocodingCandidate(
        GeocodingStatus status,
        String route,
        String streetNumber,
        String locality,
        String province,
        String postalCode,
        Confidence confidence,
        boolean ambiguous,
        String formattedAddress,
        String errorMessage) {

    public static GeocodingCandidate failed(GeocodingStatus status, String errorMessage) {
        return GeocodingCandidate.builder().status(status).errorMessage(errorMessage).build();
    }
}
