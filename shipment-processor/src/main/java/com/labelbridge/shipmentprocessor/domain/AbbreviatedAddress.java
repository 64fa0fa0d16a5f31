package com.labelbridge.shipmentprocessor.domain;

/**
 * A {@link NormalizedAddress} whose street and locality fit the carrier field maxima.
 * Postal code and province are carried over untouched.
 */
public record AbbreviatedAddress(String street, String locality, String province, String postalCode) {
}
