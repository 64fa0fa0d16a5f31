package com.labelbridge.labelservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Batch of parcels submitted in one call")
public class ParcelBatchRequest {

    @NotBlank(message = "contractCode must not be blank")
    @Schema(description = "Carrier contract the parcels are billed to", example = "CT-001",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private String contractCode;

    @Valid
    @NotEmpty(message = "parcels list must not be empty")
    @Schema(description = "Parcels to create (max 400 per call)")
    private List<ParcelRequest> parcels;
}
