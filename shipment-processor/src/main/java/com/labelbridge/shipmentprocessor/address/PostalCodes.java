package com.labelbridge.shipmentprocessor.address;

import java.util.Optional;

/**
 * Repairs the usual spreadsheet damage to Italian postal codes (CAP).
 */
public final class PostalCodes {

    private PostalCodes() {
    }

    /**
     * {@code "20121"} stays, {@code "9123"} becomes {@code "09123"}, {@code "20121.0"} becomes
     * {@code "20121"}. Anything else is empty.
     */
    public static Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (value.endsWith(".0")) {
            value = value.substring(0, value.length() - 2);
        }
        if (value.isEmpty() || value.length() > 5 || !value.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return Optional.empty();
        }
        return Optional.of("0".repeat(5 - value.length()) + value);
    }
}
