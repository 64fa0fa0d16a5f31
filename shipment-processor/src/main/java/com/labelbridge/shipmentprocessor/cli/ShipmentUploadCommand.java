package com.labelbridge.shipmentprocessor.cli;

import com.labelbridge.shipmentprocessor.batch.ShipmentRunListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * One-shot command-line run:
 * <pre>
 *   java -jar shipment-processor.jar --spring.main.web-application-type=none \
 *        --shipment.run.input-file=file:/data/negozi-NEW.csv [--shipment.run.close-work-day=true] \
 *        [--shipment.run.package-count=1 --shipment.run.weight-kg=2.5]
 * </pre>
 * Exit code 0 when every row was confirmed or already confirmed, 1 when any row was rejected,
 * failed or left unresolved, 2 when the run itself failed.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "shipment.run", name = "input-file")
public class ShipmentUploadCommand implements ApplicationRunner, ExitCodeGenerator {

    private final JobLauncher syncJobLauncher;
    private final Job shipmentUploadJob;

    @Value("${shipment.run.input-file}")
    private String inputFile;

    @Value("${shipment.run.close-work-day:false}")
    private boolean closeWorkDay;

    @Value("${shipment.run.package-count:#{null}}")
    private Integer packageCount;

    @Value("${shipment.run.weight-kg:#{null}}")
    private String weightKg;

    private int exitCode;

    public ShipmentUploadCommand(@Qualifier("syncJobLauncher") JobLauncher syncJobLauncher, Job shipmentUploadJob) {
        this.syncJobLauncher = syncJobLauncher;
        this.shipmentUploadJob = shipmentUploadJob;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        JobParametersBuilder params = new JobParametersBuilder()
                .addString("inputFile", inputFile)
                .addString("closeWorkDay", String.valueOf(closeWorkDay))
                .addLong("startedAt", Instant.now().toEpochMilli());
        if (packageCount != null) {
            params.addLong("packageCount", packageCount.longValue());
        }
        if (weightKg != null) {
            params.addString("weightKg", weightKg);
        }

        JobExecution execution = syncJobLauncher.run(shipmentUploadJob, params.toJobParameters());
        exitCode = exitCodeFor(execution);
        log.info("Run {} ended {} / {} (exit code {})", execution.getId(), execution.getStatus(),
                execution.getExitStatus().getExitCode(), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static int exitCodeFor(JobExecution execution) {
        if (execution.getStatus() != BatchStatus.COMPLETED) {
            return 2;
        }
        return ShipmentRunListener.COMPLETED_WITH_FAILURES.equals(execution.getExitStatus().getExitCode()) ? 1 : 0;
    }
}
