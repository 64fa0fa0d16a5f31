package com.labelbridge.shipmentprocessor.shipment;

import com.labelbridge.shipmentprocessor.domain.InputRow;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Deduplication keys: {@code {sourceId}:{lineNumber}:{hash}}.
 *
 * <p>The hash covers ordinal, reference, recipient, typed address and postal code, so an edited
 * row in the same position gets a new key while a re-run of an unchanged file does not.
 */
public final class Fingerprints {

    private static final int HASH_CHARS = 16;

    private Fingerprints() {
    }

    public static String of(String sourceId, InputRow row) {
        String material = String.join("|",
                nullToEmpty(row.getOrdinal()),
                nullToEmpty(row.getReference()),
                nullToEmpty(row.getRecipientName()),
                nullToEmpty(row.getAddress()),
                nullToEmpty(row.getPostalCode())).toLowerCase(Locale.ROOT);
        return sourceId + ":" + row.getLineNumber() + ":" + sha256(material).substring(0, HASH_CHARS);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
