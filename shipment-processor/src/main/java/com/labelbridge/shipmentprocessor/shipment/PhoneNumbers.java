package com.labelbridge.shipmentprocessor.shipment;

/**
 * Phone cleanup for the carrier contact field.
 */
final class PhoneNumbers {

    private PhoneNumbers() {
    }

    /** Drops separators, the spreadsheet {@code .0} artifact and the Italian country prefix. */
    static String clean(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        if (value.endsWith(".0")) {
            value = value.substring(0, value.length() - 2);
        }
        value = value.replaceAll("[\\s./()-]", "");
        if (value.startsWith("+39")) {
            value = value.substring(3);
        } else if (value.startsWith("0039")) {
            value = value.substring(4);
        }
        return value.isEmpty() ? null : value;
    }
}
