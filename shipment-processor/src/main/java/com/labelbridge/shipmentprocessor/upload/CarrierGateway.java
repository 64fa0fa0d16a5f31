package com.labelbridge.shipmentprocessor.upload;

import com.labelbridge.shipmentprocessor.domain.ShipmentRecord;

import java.util.List;
import java.util.Optional;

/**
 * Remote label service, seen as three opaque operations.
 *
 * <p>Transport failures raise {@link CarrierUnavailableException}; a whole batch refused for a
 * business reason raises {@link CarrierRejectedException}.
 */
public interface CarrierGateway {

    /** Submits up to 400 records and returns one outcome per record, matched by reference. */
    List<CarrierOutcome> submit(List<ShipmentRecord> batch);

    /** Looks a shipment up by the reference it was submitted with. Empty when the carrier has no such shipment. */
    Optional<CarrierShipmentState> queryStatus(String reference);

    /** Confirms ("closes") every open shipment of the site for today. */
    WorkDayClosure confirmOpenShipments(String site);
}
