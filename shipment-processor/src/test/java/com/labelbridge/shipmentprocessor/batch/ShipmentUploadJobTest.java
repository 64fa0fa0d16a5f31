package com.labelbridge.shipmentprocessor.batch;

import com.labelbridge.shipmentprocessor.address.AddressQuery;
import com.labelbridge.shipmentprocessor.address.GeocodingCandidate;
import com.labelbridge.shipmentprocessor.address.GeocodingProvider;
import com.labelbridge.shipmentprocessor.address.GeocodingStatus;
import com.labelbridge.shipmentprocessor.domain.Confidence;
import com.labelbridge.shipmentprocessor.upload.CarrierGateway;
import com.labelbridge.shipmentprocessor.upload.SimulatedCarrier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Full job runs against a scripted carrier and a geocoder that confirms every typed address.
 *
 * <p>Each test writes its own input file under a distinct name, so the fingerprints of one test
 * never collide with those another test left in the shared ledger.
 */
@SpringBootTest
@TestPropertySource(properties = {
        "batch.chunk-size=25",
        "batch.grid-size=3",
        "resilience4j.ratelimiter.instances.geocodingRateLimiter.limit-for-period=10000",
        "resilience4j.retry.instances.geocodingRetry.wait-duration=1ms",
        "resilience4j.retry.instances.carrierRetry.wait-duration=1ms"
})
class ShipmentUploadJobTest {

    private static final Path WORK_DIR = createWorkDir();
    private static final AtomicLong RUNS = new AtomicLong();

    private static final String NEW_HEADER =
            "Progressivo,Location negozio,Ragione sociale,Indirizzo,Comune,CAP,Provincia,Cellulare,Bda";

    @DynamicPropertySource
    static void workDirectories(DynamicPropertyRegistry registry) {
        registry.add("shipment.ledger.path", () -> WORK_DIR.resolve("ledger/upload-ledger.jsonl").toString());
        registry.add("shipment.output.dir", () -> WORK_DIR.resolve("output").toString());
    }

    @Autowired
    @Qualifier("syncJobLauncher")
    private JobLauncher jobLauncher;

    @Autowired
    private Job shipmentUploadJob;

    @MockitoBean
    private GeocodingProvider geocodingProvider;

    @MockitoBean
    private CarrierGateway carrierGateway;

    private SimulatedCarrier carrier;

    @BeforeEach
    void setUpMocks() {
        when(geocodingProvider.geocode(any())).thenAnswer(inv -> confirmAsTyped(inv.getArgument(0)));

        carrier = new SimulatedCarrier("MI");
        when(carrierGateway.submit(anyList())).thenAnswer(inv -> carrier.submit(inv.getArgument(0)));
        when(carrierGateway.queryStatus(anyString())).thenAnswer(inv -> carrier.queryStatus(inv.getArgument(0)));
        when(carrierGateway.confirmOpenShipments(anyString()))
                .thenAnswer(inv -> carrier.confirmOpenShipments(inv.getArgument(0)));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Upload
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("401 NEW rows: two batches (400 + 1), 802 packages, work day closed")
    void job_uploadsInBatchesAndClosesWorkDay() throws Exception {
        List<String> rows = new ArrayList<>();
        for (int i = 1; i <= 401; i++) {
            rows.add(i + ",Store " + i + ",Bar " + i + ",Via Roma " + i + ",Milano,20121,MI,333000" + i + ",");
        }
        Path input = writeInput("negozi_NEW_401.csv", NEW_HEADER, rows);

        JobExecution execution = launch(input, true);

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(execution.getExitStatus().getExitCode()).isEqualTo(ExitStatus.COMPLETED.getExitCode());
        assertThat(execution.getExecutionContext().getLong("prepared")).isEqualTo(401L);
        assertThat(execution.getExecutionContext().getLong("confirmed")).isEqualTo(401L);
        assertThat(execution.getExecutionContext().getLong("confirmedPackages")).isEqualTo(802L);
        assertThat(execution.getExecutionContext().getLong("batches")).isEqualTo(2L);
        assertThat(carrier.submittedBatchSizes()).containsExactly(400, 1);
        assertThat(stepNames(execution)).contains("prepareStep", "uploadStep", "closeWorkDayStep");
        verify(carrierGateway).confirmOpenShipments("MI");
        assertThat(execution.getExecutionContext().getString("summary")).contains("workDayClosed=true");
    }

    @Test
    @DisplayName("Re-running a confirmed file sends nothing and skips the close-work-day step")
    void job_rerunSendsNothing() throws Exception {
        List<String> rows = List.of(
                "1,S1,Bar Uno,Via Roma 1,Milano,20121,MI,3331,",
                "2,S2,Bar Due,Via Roma 2,Milano,20121,MI,3332,");
        Path input = writeInput("negozi_NEW_rerun.csv", NEW_HEADER, rows);

        JobExecution first = launch(input, false);
        JobExecution second = launch(input, true);

        assertThat(first.getExecutionContext().getLong("confirmed")).isEqualTo(2L);
        assertThat(second.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(second.getExitStatus().getExitCode()).isEqualTo(ExitStatus.COMPLETED.getExitCode());
        assertThat(second.getExecutionContext().getLong("confirmed")).isZero();
        assertThat(second.getExecutionContext().getLong("alreadyConfirmed")).isEqualTo(2L);
        assertThat(carrier.submittedBatchSizes()).containsExactly(2);
        assertThat(stepNames(second)).doesNotContain("closeWorkDayStep");
    }

    @Test
    @DisplayName("Mixed file: rejected rows, a carrier rejection and a repeated reference end COMPLETED_WITH_FAILURES")
    void job_mixedOutcomes() throws Exception {
        List<String> rows = List.of(
                "1,S1,Bar Uno,Via Roma 1,Milano,20121,MI,3331,MIX-1",
                "2,S2,Bar Due,Via Roma 2,Milano,ABC,MI,3332,MIX-2",
                "3,S3,,Via Roma 3,Milano,20121,MI,3333,MIX-3",
                "4,S4,Bar Quattro,Via Roma 4,Milano,20121,MI,3334,MIX-4",
                "5,S5,Bar Cinque,Via Roma 5,Milano,20121,MI,3335,MIX-5",
                "6,S6,Bar Sei,Via Roma 6,Milano,20121,MI,3336,MIX-5");
        Path input = writeInput("negozi_NEW_mixed.csv", NEW_HEADER, rows);
        carrier.rejectReference("MIX-4");

        JobExecution execution = launch(input, false);

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(execution.getExitStatus().getExitCode()).isEqualTo(ShipmentRunListener.COMPLETED_WITH_FAILURES);
        assertThat(execution.getExecutionContext().getLong("prepared")).isEqualTo(4L);
        assertThat(execution.getExecutionContext().getLong("rejected")).isEqualTo(3L);
        assertThat(execution.getExecutionContext().getLong("confirmed")).isEqualTo(2L);
        assertThat(execution.getExecutionContext().getLong("carrierFailed")).isEqualTo(1L);
        assertThat(carrier.submissionsOf("MIX-5")).isEqualTo(1);

        String rejectedReport = readReports("rejected-negozi_NEW_mixed-");
        assertThat(rejectedReport).contains("INVALID_ZIP").contains("MISSING_RECIPIENT");
        String preparedReport = readReports("prepared-negozi_NEW_mixed-");
        assertThat(preparedReport).contains("MIX-1").contains("Via Roma 1");
    }

    @Test
    @DisplayName("Unrecognized layout fails the run before any row is read")
    void job_failsOnUnrecognizedLayout() throws Exception {
        Path input = writeInput("clienti.csv", "Nome,Via,Città", List.of("Rossi,Via Roma 1,Milano"));

        JobExecution execution = launch(input, false);

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.FAILED);
        verifyNoInteractions(geocodingProvider, carrierGateway);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Helpers
    // ─────────────────────────────────────────────────────────────────────────

    private JobExecution launch(Path input, boolean closeWorkDay) throws Exception {
        return jobLauncher.run(shipmentUploadJob, new JobParametersBuilder()
                .addString("inputFile", input.toUri().toString())
                .addString("closeWorkDay", String.valueOf(closeWorkDay))
                .addLong("startedAt", System.currentTimeMillis() + RUNS.incrementAndGet())
                .toJobParameters());
    }

    private static GeocodingCandidate confirmAsTyped(AddressQuery query) {
        return GeocodingCandidate.builder()
                .status(GeocodingStatus.OK)
                .route(query.address())
                .locality(query.city())
                .province(query.province())
                .postalCode(query.postalCode())
                .confidence(Confidence.HIGH)
                .build();
    }

    private static Path writeInput(String name, String header, List<String> rows) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add(header);
        lines.addAll(rows);
        Path dir = Files.createDirectories(WORK_DIR.resolve("input"));
        return Files.write(dir.resolve(name), lines, StandardCharsets.UTF_8);
    }

    private static String readReports(String prefix) throws IOException {
        StringBuilder content = new StringBuilder();
        try (Stream<Path> files = Files.list(WORK_DIR.resolve("output"))) {
            for (Path file : files.filter(f -> f.getFileName().toString().startsWith(prefix)).toList()) {
                content.append(Files.readString(file, StandardCharsets.UTF_8));
            }
        }
        return content.toString();
    }

    private static List<String> stepNames(JobExecution execution) {
        return execution.getStepExecutions().stream().map(StepExecution::getStepName).toList();
    }

    private static Path createWorkDir() {
        try {
            return Files.createTempDirectory("shipment-job-test");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
