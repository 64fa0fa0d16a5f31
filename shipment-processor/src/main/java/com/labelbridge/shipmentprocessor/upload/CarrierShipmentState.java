package com.labelbridge.shipmentprocessor.upload;

/**
 * @param status carrier-side state, e.g. {@code OPEN} or {@code CLOSED}
 */
public record CarrierShipmentState(String reference, String shipmentNumber, String status) {
}
