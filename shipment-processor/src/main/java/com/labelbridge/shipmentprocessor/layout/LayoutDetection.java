package com.labelbridge.shipmentprocessor.layout;

import com.labelbridge.shipmentprocessor.domain.LayoutKind;

/**
 * @param kind           detected layout
 * @param headerRowIndex 0-based index of the header row among the leading rows
 * @param matchedBy      {@code "header"} or {@code "filename"}
 */
public record LayoutDetection(LayoutKind kind, int headerRowIndex, String matchedBy) {
}
