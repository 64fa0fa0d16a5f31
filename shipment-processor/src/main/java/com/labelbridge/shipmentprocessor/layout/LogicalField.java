package com.labelbridge.shipmentprocessor.layout;

/**
 * Layout-independent meaning of a spreadsheet column.
 */
public enum LogicalField {
    ORDINAL,
    RECIPIENT,
    ADDRESS,
    CITY,
    POSTAL_CODE,
    PROVINCE,
    LANDLINE,
    MOBILE,
    EMAIL,
    INSTRUCTIONS,
    REFERENCE,
    PACKAGE_COUNT,
    WEIGHT
}
