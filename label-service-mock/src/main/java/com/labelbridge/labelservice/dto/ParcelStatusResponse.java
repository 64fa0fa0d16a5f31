package com.labelbridge.labelservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@Schema(description = "A stored parcel")
public class ParcelStatusResponse {

    private final String reference;
    private final String shipmentNumber;

    @Schema(description = "OPEN until the work day is closed, then CLOSED", allowableValues = {"OPEN", "CLOSED"})
    private final String status;
}
