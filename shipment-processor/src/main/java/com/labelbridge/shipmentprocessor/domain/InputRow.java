package com.labelbridge.shipmentprocessor.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * One spreadsheet row as read from the export, before any normalization.
 *
 * <p>Column names differ between layouts; {@link com.labelbridge.shipmentprocessor.layout.LayoutColumns}
 * maps each layout's headers onto these logical fields.
 */
@Value
@Builder
public class InputRow {

    /** Physical 1-based line number in the source file. */
    int lineNumber;

    /** "Progressivo" column; may be blank. */
    String ordinal;

    String recipientName;

    String address;

    String city;

    String postalCode;

    String province;

    String landlinePhone;

    String mobilePhone;

    String email;

    /** Free-text delivery instructions (shopping-centre hints, intercom name ...). */
    String deliveryInstructions;

    /** Optional "Bda" reference supplied in the row. */
    String reference;

    /** Manual package count, only meaningful for {@link LayoutKind#AGENCY}. */
    Integer packageCount;

    /** Manual weight in kg, only meaningful for {@link LayoutKind#AGENCY}. */
    BigDecimal weightKg;

    /** Columns not mapped to a logical field, keyed by header name. */
    @Builder.Default
    Map<String, String> extras = Map.of();

    public boolean isBlank() {
        return isEmpty(recipientName) && isEmpty(address) && isEmpty(city) && isEmpty(postalCode);
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isBlank();
    }
}
