package com.labelbridge.labelservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
@Schema(description = "Per-parcel outcomes of a batch submission, in request order")
public class ParcelBatchResponse {

    private final int accepted;
    private final int rejected;
    private final List<ParcelResult> results;
}
