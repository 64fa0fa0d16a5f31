package com.labelbridge.shipmentprocessor.address;

/**
 * Free-text address components as typed in the spreadsheet.
 */
public record AddressQuery(String address, String city, String postalCode, String province) {

    /** Single-line form sent to the geocoding provider. */
    public String toSingleLine() {
        StringBuilder sb = new StringBuilder();
        append(sb, address, "");
        append(sb, postalCode, ", ");
        append(sb, city, postalCode == null || postalCode.isBlank() ? ", " : " ");
        append(sb, province, " ");
        sb.append(sb.length() == 0 ? "Italia" : ", Italia");
        return sb.toString();
    }

    private static void append(StringBuilder sb, String value, String separator) {
        if (value != null && !value.isBlank()) {
            if (sb.length() > 0) {
                sb.append(separator);
            }
            sb.append(value.trim());
        }
    }
}
