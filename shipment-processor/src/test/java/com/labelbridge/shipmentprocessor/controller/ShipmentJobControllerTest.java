package com.labelbridge.shipmentprocessor.controller;

import com.labelbridge.shipmentprocessor.config.ShipmentProperties;
import com.labelbridge.shipmentprocessor.ledger.DuplicateTracker;
import com.labelbridge.shipmentprocessor.ledger.LedgerEntry;
import com.labelbridge.shipmentprocessor.ledger.LedgerStatus;
import com.labelbridge.shipmentprocessor.upload.BatchUploader;
import com.labelbridge.shipmentprocessor.upload.CarrierRejectedException;
import com.labelbridge.shipmentprocessor.upload.CarrierUnavailableException;
import com.labelbridge.shipmentprocessor.upload.WorkDayClosure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.explore.JobExplorer;
import org.springframework.batch.core.launch.JobExecutionNotRunningException;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.batch.test.MetaDataInstanceFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ShipmentJobController.class)
class ShipmentJobControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean(name = "asyncJobLauncher")
    private JobLauncher asyncJobLauncher;

    @MockitoBean
    private Job shipmentUploadJob;

    @MockitoBean
    private JobExplorer jobExplorer;

    @MockitoBean
    private JobOperator jobOperator;

    @MockitoBean
    private DuplicateTracker duplicateTracker;

    @MockitoBean
    private BatchUploader batchUploader;

    @MockitoBean
    private ShipmentProperties properties;

    @BeforeEach
    void setUp() {
        ShipmentProperties.Input input = new ShipmentProperties.Input();
        ShipmentProperties.Carrier carrier = new ShipmentProperties.Carrier();
        carrier.setSite("MI");
        when(properties.getInput()).thenReturn(input);
        when(properties.getCarrier()).thenReturn(carrier);
    }

    // ─── upload ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("POST /upload launches the job and returns 202 with the execution id")
    void upload_launchesJob() throws Exception {
        JobExecution execution = MetaDataInstanceFactory.createJobExecution("shipmentUploadJob", 1L, 7L);
        execution.setStatus(BatchStatus.STARTING);
        when(asyncJobLauncher.run(eq(shipmentUploadJob), any(JobParameters.class))).thenReturn(execution);

        mockMvc.perform(post("/api/v1/shipments/upload")
                        .param("inputFile", "file:/data/agenzia.csv")
                        .param("closeWorkDay", "true")
                        .param("packageCount", "2")
                        .param("weightKg", "4.5"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobExecutionId").value(7))
                .andExpect(jsonPath("$.inputFile").value("file:/data/agenzia.csv"));

        ArgumentCaptor<JobParameters> params = ArgumentCaptor.forClass(JobParameters.class);
        verify(asyncJobLauncher).run(eq(shipmentUploadJob), params.capture());
        assertThat(params.getValue().getString("closeWorkDay")).isEqualTo("true");
        assertThat(params.getValue().getLong("packageCount")).isEqualTo(2L);
        assertThat(params.getValue().getString("weightKg")).isEqualTo("4.5");
        assertThat(params.getValue().getLong("startedAt")).isNotNull();
    }

    @Test
    @DisplayName("POST /upload without a file and without a default is a bad request")
    void upload_requiresInputFile() throws Exception {
        mockMvc.perform(post("/api/v1/shipments/upload"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(asyncJobLauncher);
    }

    @Test
    @DisplayName("POST /upload rejects a non-positive manual weight")
    void upload_rejectsNonPositiveWeight() throws Exception {
        mockMvc.perform(post("/api/v1/shipments/upload")
                        .param("inputFile", "file:/data/agenzia.csv")
                        .param("weightKg", "0"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(asyncJobLauncher);
    }

    // ─── status / stop ───────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /status returns the exit code and the run summary")
    void status_found() throws Exception {
        JobExecution execution = MetaDataInstanceFactory.createJobExecution("shipmentUploadJob", 1L, 9L);
        execution.setStatus(BatchStatus.COMPLETED);
        execution.setExitStatus(new ExitStatus("COMPLETED_WITH_FAILURES"));
        execution.getExecutionContext().putString("sourceId", "negozi_NEW");
        execution.getExecutionContext().putString("layout", "NEW");
        execution.getExecutionContext().putString("summary", "prepared=3 rejected=1");
        when(jobExplorer.getJobExecution(9L)).thenReturn(execution);

        mockMvc.perform(get("/api/v1/shipments/status/9"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.exitCode").value("COMPLETED_WITH_FAILURES"))
                .andExpect(jsonPath("$.layout").value("NEW"))
                .andExpect(jsonPath("$.summary").value("prepared=3 rejected=1"));
    }

    @Test
    @DisplayName("GET /status of an unknown run is 404")
    void status_notFound() throws Exception {
        mockMvc.perform(get("/api/v1/shipments/status/404"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /stop of a finished run is 409")
    void stop_notRunning() throws Exception {
        when(jobOperator.stop(5L)).thenThrow(new JobExecutionNotRunningException("run 5 is not running"));

        mockMvc.perform(post("/api/v1/shipments/stop/5"))
                .andExpect(status().isConflict());
    }

    // ─── close-work-day ──────────────────────────────────────────────────────

    @Test
    @DisplayName("POST /close-work-day uses the configured site by default")
    void closeWorkDay_defaultSite() throws Exception {
        when(batchUploader.closeWorkDay("MI")).thenReturn(new WorkDayClosure("MI", 12, "12 parcels closed"));

        mockMvc.perform(post("/api/v1/shipments/close-work-day"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.site").value("MI"))
                .andExpect(jsonPath("$.closedShipments").value(12));
    }

    @Test
    @DisplayName("POST /close-work-day maps carrier errors to 422 and 503")
    void closeWorkDay_carrierErrors() throws Exception {
        when(batchUploader.closeWorkDay("TO"))
                .thenThrow(new CarrierRejectedException("UNKNOWN_SITE", "site TO not enabled"));
        when(batchUploader.closeWorkDay("RM"))
                .thenThrow(new CarrierUnavailableException("connection refused"));

        mockMvc.perform(post("/api/v1/shipments/close-work-day").param("site", "TO"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("UNKNOWN_SITE"));
        mockMvc.perform(post("/api/v1/shipments/close-work-day").param("site", "RM"))
                .andExpect(status().isServiceUnavailable());
    }

    // ─── ledger ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /ledger returns counts and single entries")
    void ledger_lookups() throws Exception {
        when(duplicateTracker.countByStatus()).thenReturn(Map.of(LedgerStatus.CONFIRMED, 3L));
        when(duplicateTracker.find("negozi_NEW:4:abc")).thenReturn(Optional.of(LedgerEntry.builder()
                .fingerprint("negozi_NEW:4:abc")
                .status(LedgerStatus.CONFIRMED)
                .reference("BDA-4")
                .shipmentNumber("MI000000004")
                .build()));

        mockMvc.perform(get("/api/v1/shipments/ledger/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.CONFIRMED").value(3));
        mockMvc.perform(get("/api/v1/shipments/ledger/negozi_NEW:4:abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.shipmentNumber").value("MI000000004"));
        mockMvc.perform(get("/api/v1/shipments/ledger/unknown"))
                .andExpect(status().isNotFound());
    }
}
