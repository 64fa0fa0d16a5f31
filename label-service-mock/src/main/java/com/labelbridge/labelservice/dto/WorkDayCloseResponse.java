package com.labelbridge.labelservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@Schema(description = "Result of closing a site's work day")
public class WorkDayCloseResponse {

    private final String site;
    private final int closedParcels;
    private final String message;
}
