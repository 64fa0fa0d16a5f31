package com.labelbridge.shipmentprocessor.domain;

import java.util.regex.Pattern;

/**
 * Canonical address produced by the geocoding step.
 *
 * @param street     route and house number, e.g. {@code "Via Giuseppe Garibaldi, 12"}
 * @param locality   municipality as returned by the provider
 * @param province   two-letter province code
 * @param postalCode five-digit CAP
 * @param confidence provider confidence for the match
 * @param ambiguous  whether the provider returned competing candidates
 */
public record NormalizedAddress(
        String street,
        String locality,
        String province,
        String postalCode,
        Confidence confidence,
        boolean ambiguous) {

    public static final Pattern POSTAL_CODE = Pattern.compile("\\d{5}");
    public static final Pattern PROVINCE = Pattern.compile("[A-Z]{2}");

    public NormalizedAddress {
        if (postalCode == null || !POSTAL_CODE.matcher(postalCode).matches()) {
            throw new IllegalArgumentException("Postal code must be 5 digits: " + postalCode);
        }
        if (province == null || !PROVINCE.matcher(province).matches()) {
            throw new IllegalArgumentException("Province must be 2 uppercase letters: " + province);
        }
    }
}
