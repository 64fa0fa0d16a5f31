package com.labelbridge.shipmentprocessor.upload;

public record WorkDayClosure(String site, int closedShipments, String message) {
}
