package com.labelbridge.labelservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@Schema(description = "Outcome for one submitted parcel")
public class ParcelResult {

    @Schema(description = "Reference of the parcel", example = "20240115093012345-7")
    private final String reference;

    @Schema(description = "Carrier shipment number, present when ACCEPTED", example = "MI000000042")
    private final String shipmentNumber;

    @Schema(description = "ACCEPTED | REJECTED | TEMPORARY_FAILURE", example = "ACCEPTED",
            allowableValues = {"ACCEPTED", "REJECTED", "TEMPORARY_FAILURE"})
    private final String status;

    @Schema(description = "Machine-readable reason when not accepted", example = "DUPLICATE_REFERENCE")
    private final String errorCode;

    @Schema(description = "Human-readable reason when not accepted")
    private final String message;
}
