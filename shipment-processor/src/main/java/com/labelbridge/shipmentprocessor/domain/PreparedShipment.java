package com.labelbridge.shipmentprocessor.domain;

/**
 * A built shipment together with the identity used by the upload ledger.
 *
 * @param fingerprint deduplication key, never sent to the carrier
 * @param sourceId    input source identity (file stem)
 * @param lineNumber  line of the source row
 * @param shipment    the carrier record
 */
public record PreparedShipment(String fingerprint, String sourceId, int lineNumber, ShipmentRecord shipment) {

    public String reference() {
        return shipment.getReference();
    }
}
