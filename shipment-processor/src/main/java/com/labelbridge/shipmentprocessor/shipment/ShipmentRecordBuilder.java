package com.labelbridge.shipmentprocessor.shipment;

import com.labelbridge.shipmentprocessor.address.AddressAbbreviator;
import com.labelbridge.shipmentprocessor.config.ShipmentProperties;
import com.labelbridge.shipmentprocessor.domain.AbbreviatedAddress;
import com.labelbridge.shipmentprocessor.domain.CarrierFieldLimits;
import com.labelbridge.shipmentprocessor.domain.FailureKind;
import com.labelbridge.shipmentprocessor.domain.InputRow;
import com.labelbridge.shipmentprocessor.domain.LayoutKind;
import com.labelbridge.shipmentprocessor.domain.RowFailure;
import com.labelbridge.shipmentprocessor.domain.ShipmentRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps a validated, abbreviated row onto a carrier {@link ShipmentRecord}.
 *
 * <ul>
 *   <li>Package count and weight: layout defaults (OLD 1 / 3 kg, NEW 2 / 3 kg); AGENCY rows must
 *       carry both or fail with {@code MISSING_MANUAL_FIELD}.</li>
 *   <li>Phone: mobile first, landline otherwise.</li>
 *   <li>Notes: {@code ordinal-phone-instructions}, blank parts left out, cut to 40 characters.</li>
 *   <li>Reference: the row's own, or one issued by the run's {@link ReferenceGenerator}.</li>
 * </ul>
 * Pure value construction: no network, no disk.
 */
@Component
@RequiredArgsConstructor
public class ShipmentRecordBuilder {

    static final String NOTES_SEPARATOR = "-";

    private final AddressAbbreviator abbreviator;
    private final ShipmentProperties properties;

    /**
     * Row-level checks that need no address: recipient, manual fields and phone. Run before
     * geocoding so that such rows cost no provider call.
     */
    public Optional<RowFailure> precheck(InputRow row, LayoutKind layout) {
        if (isBlank(row.getRecipientName())) {
            return Optional.of(RowFailure.of(FailureKind.MISSING_RECIPIENT, "Ragione sociale mancante"));
        }
        if (!layout.hasDefaults()) {
            Integer packageCount = row.getPackageCount();
            BigDecimal weight = row.getWeightKg();
            if (packageCount == null || packageCount <= 0 || weight == null || weight.signum() <= 0) {
                return Optional.of(RowFailure.of(FailureKind.MISSING_MANUAL_FIELD,
                        "Colli=%s, peso=%s".formatted(packageCount, weight)));
            }
        }
        if (phoneOf(row) == null && properties.getCarrier().isPhoneRequired()) {
            return Optional.of(RowFailure.of(FailureKind.NO_PHONE, "Nessun telefono o cellulare"));
        }
        return Optional.empty();
    }

    public BuildResult build(InputRow row, LayoutKind layout, AbbreviatedAddress address, ReferenceGenerator references) {
        Optional<RowFailure> failure = precheck(row, layout);
        if (failure.isPresent()) {
            return BuildResult.failed(failure.get().kind(), failure.get().detail());
        }

        int packageCount = layout.hasDefaults() ? layout.getDefaultPackageCount() : row.getPackageCount();
        BigDecimal weight = layout.hasDefaults() ? layout.getDefaultWeightKg() : row.getWeightKg();
        String phone = phoneOf(row);
        ShipmentProperties.Carrier carrier = properties.getCarrier();

        String ordinal = cleanOrdinal(row.getOrdinal());
        String reference = isBlank(row.getReference()) ? references.next(ordinal) : row.getReference().trim();

        ShipmentRecord record = ShipmentRecord.builder()
                .recipientName(abbreviator.abbreviate(row.getRecipientName().trim(), CarrierFieldLimits.RECIPIENT))
                .address(address.street())
                .locality(address.locality())
                .province(address.province())
                .postalCode(address.postalCode())
                .packageCount(packageCount)
                .weightKg(weight)
                .portType(carrier.getPortType())
                .packageType(carrier.getPackageType())
                .shipmentType(carrier.getShipmentType())
                .cashOnDeliveryType(carrier.getCashOnDeliveryType())
                .notes(notes(ordinal, phone, row.getDeliveryInstructions()))
                .phone(phone)
                .email(isBlank(row.getEmail()) ? null : row.getEmail().trim())
                .reference(reference)
                .pdfFormat(carrier.getPdfFormat())
                .build();
        return BuildResult.ok(record);
    }

    String notes(String ordinal, String phone, String instructions) {
        List<String> parts = new ArrayList<>(3);
        for (String part : new String[]{ordinal, phone, instructions}) {
            if (!isBlank(part)) {
                parts.add(part.trim());
            }
        }
        if (parts.isEmpty()) {
            return null;
        }
        return abbreviator.abbreviate(String.join(NOTES_SEPARATOR, parts), CarrierFieldLimits.NOTES);
    }

    private static String phoneOf(InputRow row) {
        String mobile = PhoneNumbers.clean(row.getMobilePhone());
        return mobile != null ? mobile : PhoneNumbers.clean(row.getLandlinePhone());
    }

    /** {@code "7.0"} (numeric cell) becomes {@code "7"}. */
    static String cleanOrdinal(String ordinal) {
        if (isBlank(ordinal)) {
            return null;
        }
        String value = ordinal.trim();
        return value.endsWith(".0") ? value.substring(0, value.length() - 2) : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
