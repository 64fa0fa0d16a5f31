package com.labelbridge.labelservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * One parcel of a batch submission. Field widths are checked by the service so that an
 * over-long field rejects only its own parcel.
 */
@Getter
@Setter
@NoArgsConstructor
@Schema(description = "A parcel to create")
public class ParcelRequest {

    @NotBlank(message = "reference must not be blank")
    @Schema(description = "Customer reference (Bda), unique per site", example = "20240115093012345-7",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private String reference;

    @Schema(description = "Recipient name, at most 35 characters", example = "Ferramenta Rossi S.r.l.")
    private String recipientName;

    @Schema(description = "Street and house number, at most 35 characters", example = "P.za Duomo, 1")
    private String address;

    @Schema(description = "Municipality, at most 30 characters", example = "Milano")
    private String locality;

    @Schema(description = "Two-letter province code", example = "MI")
    private String province;

    @Schema(description = "Five-digit postal code", example = "20121")
    private String postalCode;

    @Schema(description = "Number of packages", example = "2")
    private int packages;

    @Schema(description = "Total weight in kg", example = "3")
    private BigDecimal weightKg;

    @Schema(description = "F (franco) or A (assegnato)", example = "F")
    private String portType;

    @Schema(description = "Package type code", example = "0")
    private String packageType;

    @Schema(description = "N (nazionale) or P (parcel)", example = "N")
    private String shipmentType;

    @Schema(description = "Cash-on-delivery type, empty for none", example = "")
    private String cashOnDeliveryType;

    @Schema(description = "Notes printed on the label, at most 40 characters", example = "7-3331234567")
    private String notes;

    @Schema(description = "Contact phone", example = "3331234567")
    private String phone;

    @Schema(description = "Contact e-mail", example = "negozio@example.it")
    private String email;

    @Schema(description = "Label format", example = "A6", allowableValues = {"A4", "A6"})
    private String pdfFormat;
}
