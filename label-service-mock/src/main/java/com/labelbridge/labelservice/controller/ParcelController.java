package com.labelbridge.labelservice.controller;

import com.labelbridge.labelservice.config.MockCarrierProperties.CarrierAccount;
import com.labelbridge.labelservice.dto.ErrorResponse;
import com.labelbridge.labelservice.dto.ParcelBatchRequest;
import com.labelbridge.labelservice.dto.ParcelBatchResponse;
import com.labelbridge.labelservice.dto.ParcelStatusResponse;
import com.labelbridge.labelservice.dto.WorkDayCloseResponse;
import com.labelbridge.labelservice.service.LabelService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Carrier label service endpoints. Every call authenticates with the
 * {@code X-Carrier-Site}, {@code X-Carrier-Customer} and {@code X-Carrier-Password} headers.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(
        name = "Parcels",
        description = """
                Batch parcel creation, lookup by reference and work-day closing.
                Each request incurs a simulated latency (default 200 ms).
                """
)
public class ParcelController {

    static final String HEADER_SITE = "X-Carrier-Site";
    static final String HEADER_CUSTOMER = "X-Carrier-Customer";
    static final String HEADER_PASSWORD = "X-Carrier-Password";

    private final LabelService labelService;

    @PostMapping(
            value = "/parcels/batch",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
            summary = "Create a batch of parcels",
            description = """
                    Creates up to **400** parcels. Each parcel is checked on its own and gets its own
                    outcome; the response lists them in request order.
                    
                    Parcel-level rejections:
                    - `DUPLICATE_REFERENCE`: the reference is already used for this site
                    - `INVALID_CONTRACT_CODE`: the contract code is not enabled
                    - `FIELD_TOO_LONG`: recipient > 35, address > 35, locality > 30 or notes > 40
                    - `INVALID_POSTAL_CODE`, `INVALID_PACKAGES`
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Per-parcel outcomes",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = ParcelBatchResponse.class))),
            @ApiResponse(responseCode = "401", description = "Invalid credentials",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "422", description = "Batch larger than 400 parcels",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<ParcelBatchResponse> submitBatch(
            @RequestHeader(HEADER_SITE) String site,
            @RequestHeader(HEADER_CUSTOMER) String customerCode,
            @RequestHeader(value = HEADER_PASSWORD, required = false) String password,
            @Valid @RequestBody ParcelBatchRequest request) {
        CarrierAccount account = labelService.authenticate(site, customerCode, password);
        return ResponseEntity.ok(labelService.submitBatch(account, request));
    }

    @GetMapping(value = "/parcels", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Look up a parcel by reference",
            description = "Answers `404` with error code `PARCEL_NOT_FOUND` when the site has no such parcel.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Parcel found",
                    content = @Content(schema = @Schema(implementation = ParcelStatusResponse.class))),
            @ApiResponse(responseCode = "404", description = "No parcel with this reference",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<ParcelStatusResponse> findParcel(
            @RequestHeader(HEADER_SITE) String site,
            @RequestHeader(HEADER_CUSTOMER) String customerCode,
            @RequestHeader(value = HEADER_PASSWORD, required = false) String password,
            @RequestParam("reference") String reference) {
        CarrierAccount account = labelService.authenticate(site, customerCode, password);
        return ResponseEntity.ok(labelService.findByReference(account, reference));
    }

    @PostMapping(value = "/work-day/close", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Close the work day of a site",
            description = "Confirms every OPEN parcel of the site; they become CLOSED and final for pickup.")
    public ResponseEntity<WorkDayCloseResponse> closeWorkDay(
            @RequestHeader(HEADER_SITE) String site,
            @RequestHeader(HEADER_CUSTOMER) String customerCode,
            @RequestHeader(value = HEADER_PASSWORD, required = false) String password,
            @RequestParam("site") String siteToClose) {
        CarrierAccount account = labelService.authenticate(site, customerCode, password);
        return ResponseEntity.ok(labelService.closeWorkDay(account, siteToClose));
    }
}
