package com.labelbridge.labelservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Error body of every non-2xx answer")
public record ErrorResponse(
        @Schema(example = "PARCEL_NOT_FOUND") String errorCode,
        String message) {}
