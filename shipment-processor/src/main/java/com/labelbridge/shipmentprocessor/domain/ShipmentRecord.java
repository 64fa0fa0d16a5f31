package com.labelbridge.shipmentprocessor.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Carrier-bound shipment ("parcel") record. Field lengths already respect {@link CarrierFieldLimits}.
 */
@Value
@Builder(toBuilder = true)
public class ShipmentRecord {

    String recipientName;
    String address;
    String locality;
    String province;
    String postalCode;

    int packageCount;
    BigDecimal weightKg;

    /** Port type code, e.g. {@code F} (franco). */
    String portType;
    String packageType;
    String shipmentType;
    /** Cash-on-delivery type; blank when no COD is requested. */
    String cashOnDeliveryType;

    String notes;
    String phone;
    String email;

    /** "Bda" reference, unique per run. */
    String reference;

    String pdfFormat;
}
