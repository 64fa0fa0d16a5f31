package com.labelbridge.shipmentprocessor.batch;

import com.labelbridge.shipmentprocessor.config.ShipmentProperties;
import com.labelbridge.shipmentprocessor.shipment.ReferenceGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionListener;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Opens and closes a {@link ShipmentRun} around each job execution.
 *
 * <p>{@link #beforeJob} inspects the input file; an unrecognized layout fails the job before any
 * row is read. {@link #afterJob} copies the {@link RunSummary} into the job execution context and
 * marks the exit status {@value #COMPLETED_WITH_FAILURES} when any row was rejected, failed at the
 * carrier or ended with an unknown outcome.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShipmentRunListener implements JobExecutionListener {

    public static final String COMPLETED_WITH_FAILURES = "COMPLETED_WITH_FAILURES";

    private final InputSourceInspector inspector;
    private final ShipmentRunRegistry runRegistry;
    private final ShipmentProperties properties;
    private final JobRepository jobRepository;
    private final Clock clock;

    @Override
    public void beforeJob(JobExecution jobExecution) {
        JobParameters params = jobExecution.getJobParameters();
        String inputFile = params.getString("inputFile", properties.getInput().getDefaultFile());
        Integer manualPackageCount = Optional.ofNullable(params.getLong("packageCount")).map(Long::intValue).orElse(null);
        BigDecimal manualWeight = Optional.ofNullable(params.getString("weightKg")).map(BigDecimal::new).orElse(null);

        InputSource source = inspector.inspect(inputFile);
        ShipmentRun run = new ShipmentRun(jobExecution.getId(), source,
                new ReferenceGenerator(LocalDateTime.now(clock)), manualPackageCount, manualWeight);
        runRegistry.register(run);

        ExecutionContext ctx = jobExecution.getExecutionContext();
        ctx.putString("sourceId", source.sourceId());
        ctx.putString("layout", source.layout().name());
        ctx.putInt("dataLines", source.dataLineCount());
        log.info("Shipment run {} started: source={}, layout={}, dataLines={}",
                jobExecution.getId(), source.sourceId(), source.layout(), source.dataLineCount());
    }

    @Override
    public void afterJob(JobExecution jobExecution) {
        Optional<ShipmentRun> run = runRegistry.find(jobExecution.getId());
        if (run.isEmpty()) {
            log.warn("Shipment run {} ended with status {} before it was opened",
                    jobExecution.getId(), jobExecution.getStatus());
            return;
        }
        try {
            RunSummary summary = run.get().summary();
            ExecutionContext ctx = jobExecution.getExecutionContext();
            ctx.putLong("prepared", summary.getPrepared());
            ctx.putLong("rejected", summary.rejectedTotal());
            ctx.putLong("confirmed", summary.getConfirmed());
            ctx.putLong("confirmedPackages", summary.getConfirmedPackages());
            ctx.putLong("carrierFailed", summary.getCarrierFailed());
            ctx.putLong("unresolved", summary.getUnresolved());
            ctx.putLong("alreadyConfirmed", summary.getAlreadyConfirmed());
            ctx.putLong("batches", summary.getBatches());
            ctx.putString("summary", summary.describe());
            jobRepository.updateExecutionContext(jobExecution);

            if (jobExecution.getStatus() == BatchStatus.COMPLETED && summary.hasFailures()) {
                jobExecution.setExitStatus(new ExitStatus(COMPLETED_WITH_FAILURES, summary.describe()));
            }
            log.info("Shipment run {} finished with {}: {}", jobExecution.getId(),
                    jobExecution.getExitStatus().getExitCode(), summary.describe());
        } finally {
            runRegistry.unregister(jobExecution.getId());
        }
    }
}
