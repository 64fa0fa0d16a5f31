package com.labelbridge.shipmentprocessor.shipment;

import com.labelbridge.shipmentprocessor.address.AddressAbbreviator;
import com.labelbridge.shipmentprocessor.config.ShipmentProperties;
import com.labelbridge.shipmentprocessor.domain.AbbreviatedAddress;
import com.labelbridge.shipmentprocessor.domain.FailureKind;
import com.labelbridge.shipmentprocessor.domain.InputRow;
import com.labelbridge.shipmentprocessor.domain.LayoutKind;
import com.labelbridge.shipmentprocessor.domain.ShipmentRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class ShipmentRecordBuilderTest {

    private static final AbbreviatedAddress ADDRESS = new AbbreviatedAddress("Via Roma, 1", "Milano", "MI", "20121");

    private ShipmentProperties properties;
    private ShipmentRecordBuilder builder;
    private ReferenceGenerator references;

    @BeforeEach
    void setUp() {
        properties = new ShipmentProperties();
        properties.getCarrier().setSite("MI");
        properties.getCarrier().setCustomerCode("100001");
        properties.getCarrier().setContractCode("CT-001");
        builder = new ShipmentRecordBuilder(new AddressAbbreviator(), properties);
        references = new ReferenceGenerator(LocalDateTime.of(2024, 3, 18, 9, 30, 0));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Layout defaults
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("OLD rows ship 1 package of 3 kg")
    void build_oldDefaults() {
        ShipmentRecord record = buildOk(row().build(), LayoutKind.OLD);

        assertThat(record.getPackageCount()).isEqualTo(1);
        assertThat(record.getWeightKg()).isEqualByComparingTo("3");
    }

    @Test
    @DisplayName("NEW rows ship 2 packages of 3 kg, whatever the row says")
    void build_newDefaults() {
        ShipmentRecord record = buildOk(row().packageCount(9).weightKg(new BigDecimal("20")).build(), LayoutKind.NEW);

        assertThat(record.getPackageCount()).isEqualTo(2);
        assertThat(record.getWeightKg()).isEqualByComparingTo("3");
    }

    @Test
    @DisplayName("AGENCY rows use the manual package count and weight")
    void build_agencyManualValues() {
        ShipmentRecord record = buildOk(row().packageCount(4).weightKg(new BigDecimal("12.5")).build(), LayoutKind.AGENCY);

        assertThat(record.getPackageCount()).isEqualTo(4);
        assertThat(record.getWeightKg()).isEqualByComparingTo("12.5");
    }

    @Test
    @DisplayName("MISSING_MANUAL_FIELD: AGENCY row without package count or weight")
    void build_agencyWithoutManualValues() {
        BuildResult missingWeight = builder.build(row().packageCount(2).build(), LayoutKind.AGENCY, ADDRESS, references);
        BuildResult zeroCount = builder.build(row().packageCount(0).weightKg(BigDecimal.ONE).build(),
                LayoutKind.AGENCY, ADDRESS, references);

        assertThat(missingWeight.failure().kind()).isEqualTo(FailureKind.MISSING_MANUAL_FIELD);
        assertThat(zeroCount.failure().kind()).isEqualTo(FailureKind.MISSING_MANUAL_FIELD);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Notes and phone
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Notes join ordinal and phone with '-'")
    void build_notesOrdinalAndPhone() {
        ShipmentRecord record = buildOk(row().ordinal("7").mobilePhone("333 1234567").build(), LayoutKind.OLD);

        assertThat(record.getNotes()).isEqualTo("7-3331234567");
        assertThat(record.getPhone()).isEqualTo("3331234567");
    }

    @Test
    @DisplayName("Notes carry delivery instructions as third part")
    void build_notesWithInstructions() {
        ShipmentRecord record = buildOk(row().ordinal("7.0").mobilePhone("+39 333 1234567")
                .deliveryInstructions("Citofonare Rossi").build(), LayoutKind.OLD);

        assertThat(record.getNotes()).isEqualTo("7-3331234567-Citofonare Rossi");
    }

    @Test
    void build_notesFitTheCarrierField() {
        ShipmentRecord record = buildOk(row().ordinal("12").mobilePhone("3331234567")
                .deliveryInstructions("Centro Commerciale Porta di Roma, ingresso lato parcheggio").build(), LayoutKind.OLD);

        assertThat(record.getNotes()).hasSizeLessThanOrEqualTo(40).startsWith("12-3331234567-C.C.");
    }

    @Test
    @DisplayName("Mobile wins over landline; landline used when there is no mobile")
    void build_phonePrecedence() {
        ShipmentRecord both = buildOk(row().mobilePhone("347.7654321").landlinePhone("02 1234567").build(), LayoutKind.OLD);
        ShipmentRecord landlineOnly = buildOk(row().landlinePhone("02-1234567").build(), LayoutKind.OLD);

        assertThat(both.getPhone()).isEqualTo("3477654321");
        assertThat(landlineOnly.getPhone()).isEqualTo("021234567");
    }

    @Test
    @DisplayName("NO_PHONE only when a phone is required")
    void build_noPhone() {
        InputRow row = row().build();
        assertThat(builder.build(row, LayoutKind.OLD, ADDRESS, references).isSuccess()).isTrue();

        properties.getCarrier().setPhoneRequired(true);
        assertThat(builder.build(row, LayoutKind.OLD, ADDRESS, references).failure().kind()).isEqualTo(FailureKind.NO_PHONE);
    }

    @Test
    void precheck_missingRecipient() {
        assertThat(builder.precheck(row().recipientName("  ").build(), LayoutKind.NEW))
                .hasValueSatisfying(f -> assertThat(f.kind()).isEqualTo(FailureKind.MISSING_RECIPIENT));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Carrier fields and reference
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Carrier codes come from configuration, address from the abbreviated address")
    void build_copiesCarrierCodesAndAddress() {
        ShipmentRecord record = buildOk(row().email(" bar@example.it ").build(), LayoutKind.OLD);

        assertThat(record.getAddress()).isEqualTo("Via Roma, 1");
        assertThat(record.getLocality()).isEqualTo("Milano");
        assertThat(record.getProvince()).isEqualTo("MI");
        assertThat(record.getPostalCode()).isEqualTo("20121");
        assertThat(record.getPortType()).isEqualTo("F");
        assertThat(record.getPdfFormat()).isEqualTo("A6");
        assertThat(record.getEmail()).isEqualTo("bar@example.it");
    }

    @Test
    void build_recipientAbbreviated() {
        ShipmentRecord record = buildOk(row().recipientName("Farmacia Comunale Santa Maria della Misericordia Srl").build(),
                LayoutKind.OLD);

        assertThat(record.getRecipientName()).hasSizeLessThanOrEqualTo(35);
    }

    @Test
    @DisplayName("Row reference is kept; missing ones are issued as {stamp}-{ordinal}")
    void build_reference() {
        ShipmentRecord own = buildOk(row().reference("BDA-991").build(), LayoutKind.OLD);
        ShipmentRecord issued = buildOk(row().ordinal("7").build(), LayoutKind.OLD);

        assertThat(own.getReference()).isEqualTo("BDA-991");
        assertThat(issued.getReference()).isEqualTo("20240318093000000-7");
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Helpers
    // ─────────────────────────────────────────────────────────────────────────

    private ShipmentRecord buildOk(InputRow row, LayoutKind layout) {
        BuildResult result = builder.build(row, layout, ADDRESS, references);
        assertThat(result.isSuccess()).as("build failed: %s", result.failure()).isTrue();
        return result.record();
    }

    private static InputRow.InputRowBuilder row() {
        return InputRow.builder()
                .lineNumber(2)
                .recipientName("Bar Sport")
                .address("Via Roma 1")
                .city("Milano")
                .postalCode("20121")
                .province("MI");
    }
}
