package com.labelbridge.shipmentprocessor.controller;

import com.labelbridge.shipmentprocessor.config.ShipmentProperties;
import com.labelbridge.shipmentprocessor.ledger.DuplicateTracker;
import com.labelbridge.shipmentprocessor.ledger.LedgerEntry;
import com.labelbridge.shipmentprocessor.ledger.LedgerStatus;
import com.labelbridge.shipmentprocessor.upload.BatchUploader;
import com.labelbridge.shipmentprocessor.upload.CarrierRejectedException;
import com.labelbridge.shipmentprocessor.upload.CarrierUnavailableException;
import com.labelbridge.shipmentprocessor.upload.WorkDayClosure;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.explore.JobExplorer;
import org.springframework.batch.core.launch.JobExecutionNotRunningException;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.batch.core.launch.NoSuchJobExecutionException;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * REST API for triggering and monitoring shipment upload runs.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/shipments")
@Tag(name = "Shipment Upload", description = "Normalize spreadsheet exports and upload them to the carrier")
public class ShipmentJobController {

    private final JobLauncher asyncJobLauncher;
    private final Job shipmentUploadJob;
    private final JobExplorer jobExplorer;
    private final JobOperator jobOperator;
    private final DuplicateTracker duplicateTracker;
    private final BatchUploader batchUploader;
    private final ShipmentProperties properties;

    public ShipmentJobController(@Qualifier("asyncJobLauncher") JobLauncher asyncJobLauncher,
                                 Job shipmentUploadJob,
                                 JobExplorer jobExplorer,
                                 JobOperator jobOperator,
                                 DuplicateTracker duplicateTracker,
                                 BatchUploader batchUploader,
                                 ShipmentProperties properties) {
        this.asyncJobLauncher = asyncJobLauncher;
        this.shipmentUploadJob = shipmentUploadJob;
        this.jobExplorer = jobExplorer;
        this.jobOperator = jobOperator;
        this.duplicateTracker = duplicateTracker;
        this.batchUploader = batchUploader;
        this.properties = properties;
    }

    // ─── POST /api/v1/shipments/upload ───────────────────────────────────────

    @PostMapping("/upload")
    @Operation(
            summary = "Start a shipment upload run",
            description = "Launches the upload job **asynchronously** and returns `202` with the `jobExecutionId`. "
                    + "Poll `GET /api/v1/shipments/status/{jobExecutionId}` to follow it. "
                    + "`packageCount` and `weightKg` are required for agency exports whose rows do not carry them.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Run accepted and started in the background",
                            content = @Content(schema = @Schema(implementation = JobStartResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid manual package count or weight"),
                    @ApiResponse(responseCode = "500", description = "Failed to launch the run",
                            content = @Content(schema = @Schema(implementation = Map.class)))
            })
    public ResponseEntity<?> startUpload(
            @Parameter(description = "Absolute path or Spring resource path to the CSV export. "
                    + "Leave blank to use the default configured in application.yml.",
                    example = "file:/data/exports/negozi-NEW.csv")
            @RequestParam(value = "inputFile", required = false) String inputFile,
            @Parameter(description = "Close the carrier work day after a run that confirmed at least one shipment")
            @RequestParam(value = "closeWorkDay", defaultValue = "false") boolean closeWorkDay,
            @Parameter(description = "Packages per shipment for rows that do not state it (agency layout)")
            @RequestParam(value = "packageCount", required = false) Integer packageCount,
            @Parameter(description = "Weight in kg for rows that do not state it (agency layout)", example = "2.5")
            @RequestParam(value = "weightKg", required = false) BigDecimal weightKg) {

        String defaultFile = properties.getInput().getDefaultFile();
        String resolvedFile = (inputFile != null && !inputFile.isBlank()) ? inputFile : defaultFile;
        if (resolvedFile == null || resolvedFile.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "No inputFile given and no default configured"));
        }
        if ((packageCount != null && packageCount <= 0) || (weightKg != null && weightKg.signum() <= 0)) {
            return ResponseEntity.badRequest().body(Map.of("error", "packageCount and weightKg must be positive"));
        }
        log.info("Starting shipmentUploadJob with inputFile='{}', closeWorkDay={}", resolvedFile, closeWorkDay);

        try {
            JobParametersBuilder builder = new JobParametersBuilder()
                    .addString("inputFile", resolvedFile)
                    .addString("closeWorkDay", String.valueOf(closeWorkDay))
                    .addLong("startedAt", Instant.now().toEpochMilli());   // ensures unique run
            if (packageCount != null) {
                builder.addLong("packageCount", packageCount.longValue());
            }
            if (weightKg != null) {
                builder.addString("weightKg", weightKg.toPlainString());
            }
            JobParameters params = builder.toJobParameters();

            JobExecution execution = asyncJobLauncher.run(shipmentUploadJob, params);

            return ResponseEntity.accepted().body(new JobStartResponse(
                    execution.getId(),
                    execution.getStatus().name(),
                    resolvedFile,
                    execution.getStartTime() != null ? execution.getStartTime().toString() : null));

        } catch (Exception e) {
            log.error("Failed to start job: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to start job: " + e.getMessage()));
        }
    }

    // ─── GET /api/v1/shipments/status/{jobExecutionId} ──────────────────────

    @GetMapping("/status/{jobExecutionId}")
    @Operation(
            summary = "Get run status",
            description = "Status, exit code, per-step counts and, once finished, the run summary.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Run found",
                            content = @Content(schema = @Schema(implementation = JobStatusResponse.class))),
                    @ApiResponse(responseCode = "404", description = "Run not found")
            })
    public ResponseEntity<?> getStatus(
            @Parameter(name = "jobExecutionId", description = "The id returned by /upload", required = true)
            @PathVariable("jobExecutionId") Long jobExecutionId) {

        JobExecution execution = jobExplorer.getJobExecution(jobExecutionId);
        if (execution == null) {
            return ResponseEntity.notFound().build();
        }

        LocalDateTime startTime = execution.getStartTime();
        LocalDateTime endTime = execution.getEndTime();
        String elapsed = null;
        if (startTime != null) {
            LocalDateTime until = (endTime != null) ? endTime : LocalDateTime.now();
            elapsed = Duration.between(startTime, until).toSeconds() + "s";
        }

        List<StepDetail> steps = execution.getStepExecutions().stream()
                .sorted(Comparator.comparing(StepExecution::getStepName))
                .map(se -> new StepDetail(
                        se.getStepName(),
                        se.getStatus().name(),
                        se.getReadCount(),
                        se.getWriteCount(),
                        se.getFilterCount(),
                        se.getStartTime() != null ? se.getStartTime().toString() : null,
                        se.getEndTime() != null ? se.getEndTime().toString() : null))
                .toList();

        ExecutionContext ctx = execution.getExecutionContext();
        return ResponseEntity.ok(new JobStatusResponse(
                jobExecutionId,
                execution.getStatus().name(),
                execution.getExitStatus().getExitCode(),
                ctx.containsKey("sourceId") ? ctx.getString("sourceId") : null,
                ctx.containsKey("layout") ? ctx.getString("layout") : null,
                startTime != null ? startTime.toString() : null,
                endTime != null ? endTime.toString() : null,
                elapsed,
                ctx.containsKey("summary") ? ctx.getString("summary") : null,
                steps));
    }

    // ─── POST /api/v1/shipments/stop/{jobExecutionId} ───────────────────────

    @PostMapping("/stop/{jobExecutionId}")
    @Operation(
            summary = "Stop a running upload",
            description = "Requests a stop; the upload finishes the batch in progress and sends no further batch.")
    public ResponseEntity<?> stop(@PathVariable("jobExecutionId") Long jobExecutionId) {
        try {
            boolean signalled = jobOperator.stop(jobExecutionId);
            return ResponseEntity.accepted().body(Map.of("jobExecutionId", jobExecutionId, "stopRequested", signalled));
        } catch (NoSuchJobExecutionException e) {
            return ResponseEntity.notFound().build();
        } catch (JobExecutionNotRunningException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    // ─── POST /api/v1/shipments/close-work-day ──────────────────────────────

    @PostMapping("/close-work-day")
    @Operation(
            summary = "Close the carrier work day",
            description = "Confirms every open shipment of the site so the labels become final for pickup.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Work day closed",
                            content = @Content(schema = @Schema(implementation = WorkDayClosure.class))),
                    @ApiResponse(responseCode = "422", description = "Rejected by the carrier"),
                    @ApiResponse(responseCode = "503", description = "Carrier unavailable")
            })
    public ResponseEntity<?> closeWorkDay(
            @Parameter(description = "Carrier site code; defaults to the configured one")
            @RequestParam(value = "site", required = false) String site) {
        String resolvedSite = (site != null && !site.isBlank()) ? site : properties.getCarrier().getSite();
        try {
            return ResponseEntity.ok(batchUploader.closeWorkDay(resolvedSite));
        } catch (CarrierRejectedException e) {
            log.warn("Close work day rejected for site {}: {}", resolvedSite, e.getMessage());
            return ResponseEntity.unprocessableEntity()
                    .body(Map.of("error", e.getMessage(), "errorCode", e.getErrorCode()));
        } catch (CarrierUnavailableException e) {
            log.warn("Close work day failed for site {}: {}", resolvedSite, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    // ─── Ledger ──────────────────────────────────────────────────────────────

    @GetMapping("/ledger/stats")
    @Operation(summary = "Upload ledger entries by status")
    public Map<LedgerStatus, Long> ledgerStats() {
        return duplicateTracker.countByStatus();
    }

    @GetMapping("/ledger/{fingerprint}")
    @Operation(summary = "Look up one ledger entry by row fingerprint")
    public ResponseEntity<LedgerEntry> ledgerEntry(@PathVariable("fingerprint") String fingerprint) {
        return duplicateTracker.find(fingerprint)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    // ─── Response records ────────────────────────────────────────────────────

    public record JobStartResponse(Long jobExecutionId, String status, String inputFile, String startTime) {}

    /**
     * @param summary run summary line, present once the run has finished
     * @param steps   per-step breakdown (manager, partitions, upload, close-work-day), sorted by name
     */
    public record JobStatusResponse(
            Long jobExecutionId,
            String status,
            String exitCode,
            String sourceId,
            String layout,
            String startTime,
            String endTime,
            String elapsed,
            String summary,
            List<StepDetail> steps) {}

    public record StepDetail(
            String step,
            String status,
            long readCount,
            long writeCount,
            long filterCount,
            String startTime,
            String endTime) {}
}
