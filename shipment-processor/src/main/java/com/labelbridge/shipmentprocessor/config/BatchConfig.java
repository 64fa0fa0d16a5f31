package com.labelbridge.shipmentprocessor.config;

import com.labelbridge.shipmentprocessor.address.AddressAbbreviator;
import com.labelbridge.shipmentprocessor.address.AddressNormalizer;
import com.labelbridge.shipmentprocessor.batch.CloseWorkDayDecider;
import com.labelbridge.shipmentprocessor.batch.CloseWorkDayTasklet;
import com.labelbridge.shipmentprocessor.batch.InputRowLineMapper;
import com.labelbridge.shipmentprocessor.batch.PreparedShipmentWriter;
import com.labelbridge.shipmentprocessor.batch.RangePartitioner;
import com.labelbridge.shipmentprocessor.batch.ShipmentItemProcessor;
import com.labelbridge.shipmentprocessor.batch.ShipmentRun;
import com.labelbridge.shipmentprocessor.batch.ShipmentRunListener;
import com.labelbridge.shipmentprocessor.batch.ShipmentRunRegistry;
import com.labelbridge.shipmentprocessor.batch.ShipmentUploadTasklet;
import com.labelbridge.shipmentprocessor.domain.InputRow;
import com.labelbridge.shipmentprocessor.domain.ProcessedRow;
import com.labelbridge.shipmentprocessor.ledger.DuplicateTracker;
import com.labelbridge.shipmentprocessor.shipment.ShipmentRecordBuilder;
import com.labelbridge.shipmentprocessor.upload.BatchUploader;
import com.labelbridge.shipmentprocessor.upload.CarrierGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.explore.JobExplorer;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.core.launch.support.TaskExecutorJobLauncher;
import org.springframework.batch.core.partition.PartitionHandler;
import org.springframework.batch.core.partition.support.TaskExecutorPartitionHandler;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;

import java.nio.charset.StandardCharsets;

/**
 * Central Spring Batch configuration.
 *
 * <h3>Architecture</h3>
 * <pre>
 *  shipmentUploadJob ─► prepareStep (partitioned)
 *        │                  │
 *        │                  ├── RangePartitioner  (data lines → N execution contexts)
 *        │                  └── workerStep (chunk-oriented, one thread per partition)
 *        │                          ├── FlatFileItemReader<InputRow>  (assigned line range)
 *        │                          ├── ShipmentItemProcessor         (normalize, abbreviate, build)
 *        │                          └── PreparedShipmentWriter        (stage + prepared/rejected CSV)
 *        │
 *        ├─► uploadStep            (reconcile ledger, admit, upload in batches of ≤ 400)
 *        │
 *        └─► closeWorkDayDecider ──CLOSE──► closeWorkDayStep
 *                               └──*──────► end
 * </pre>
 *
 * <p>{@link ShipmentRunListener} inspects the input file and opens the run before the first step.
 * Geocoding is the only work done concurrently; the upload step is sequential so that batch
 * ordering and ledger writes stay simple.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class BatchConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final ResourceLoader resourceLoader;
    private final ShipmentProperties properties;
    private final ShipmentRunRegistry runRegistry;
    private final ShipmentRunListener runListener;
    private final AddressNormalizer addressNormalizer;
    private final AddressAbbreviator addressAbbreviator;
    private final ShipmentRecordBuilder recordBuilder;
    private final DuplicateTracker duplicateTracker;
    private final BatchUploader batchUploader;
    private final CarrierGateway carrierGateway;
    private final JobExplorer jobExplorer;

    @Value("${batch.chunk-size:50}")
    private int chunkSize;

    @Value("${batch.grid-size:4}")
    private int gridSize;

    // ─── Job ─────────────────────────────────────────────────────────────────

    @Bean
    public Job shipmentUploadJob() {
        return new JobBuilder("shipmentUploadJob", jobRepository)
                .listener(runListener)
                .flow(prepareStep())
                .next(uploadStep())
                .next(closeWorkDayDecider())
                .on(CloseWorkDayDecider.CLOSE).to(closeWorkDayStep())
                .from(closeWorkDayDecider()).on("*").end()
                .end()
                .build();
    }

    // ─── Job launchers ───────────────────────────────────────────────────────

    /**
     * An async {@link JobLauncher}: {@code run(...)} returns immediately with
     * {@code BatchStatus.STARTING}; callers poll {@code GET /api/v1/shipments/status/{id}}.
     */
    @Bean("asyncJobLauncher")
    @Primary
    public JobLauncher asyncJobLauncher() throws Exception {
        TaskExecutorJobLauncher launcher = new TaskExecutorJobLauncher();
        launcher.setJobRepository(jobRepository);
        launcher.setTaskExecutor(new SimpleAsyncTaskExecutor("job-launcher-"));
        launcher.afterPropertiesSet();
        return launcher;
    }

    /** Blocks until the job ends; used by the command-line runner and by tests. */
    @Bean("syncJobLauncher")
    public JobLauncher syncJobLauncher() throws Exception {
        TaskExecutorJobLauncher launcher = new TaskExecutorJobLauncher();
        launcher.setJobRepository(jobRepository);
        launcher.setTaskExecutor(new SyncTaskExecutor());
        launcher.afterPropertiesSet();
        return launcher;
    }

    // ─── Prepare step (partitioned) ──────────────────────────────────────────

    @Bean
    public Step prepareStep() {
        return new StepBuilder("prepareStep", jobRepository)
                .partitioner("workerStep", partitioner(null))   // resolved per job execution
                .partitionHandler(partitionHandler())
                .build();
    }

    /**
     * Sized from the {@link ShipmentRun} that {@link ShipmentRunListener} opened for this job
     * execution: the data line count and the first data line below the header.
     */
    @Bean
    @StepScope
    public RangePartitioner partitioner(@Value("#{stepExecution.jobExecutionId}") Long jobExecutionId) {
        ShipmentRun run = runRegistry.require(jobExecutionId);
        log.info("Partitioning '{}': {} data lines, gridSize={}",
                run.getSourceId(), run.getSource().dataLineCount(), gridSize);
        return new RangePartitioner(run.getSource().dataLineCount(), run.getSource().firstDataLine());
    }

    @Bean
    public PartitionHandler partitionHandler() {
        TaskExecutorPartitionHandler handler = new TaskExecutorPartitionHandler();
        handler.setTaskExecutor(partitionTaskExecutor());
        handler.setStep(workerStep());
        handler.setGridSize(gridSize);
        return handler;
    }

    /** One pooled thread per partition; geocoding calls are further bounded by the bulkhead. */
    @Bean
    public TaskExecutor partitionTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(gridSize);
        executor.setMaxPoolSize(gridSize);
        executor.setThreadNamePrefix("batch-worker-");
        executor.initialize();
        return executor;
    }

    // ─── Worker step (chunk-oriented) ────────────────────────────────────────

    @Bean
    public Step workerStep() {
        return new StepBuilder("workerStep", jobRepository)
                .<InputRow, ProcessedRow>chunk(chunkSize, transactionManager)
                .reader(workerItemReader(null, 0, 0))   // placeholders, overridden by @StepScope
                .processor(shipmentItemProcessor(null))
                .writer(workerItemWriter(null, 0))
                .build();
    }

    @Bean
    @StepScope
    public FlatFileItemReader<InputRow> workerItemReader(
            @Value("#{stepExecution.jobExecutionId}") Long jobExecutionId,
            @Value("#{stepExecutionContext['startLine'] ?: 2}") int startLine,
            @Value("#{stepExecutionContext['endLine'] ?: 1}") int endLine) {

        ShipmentRun run = runRegistry.require(jobExecutionId);
        log.debug("workerItemReader: source={}, startLine={}, endLine={}", run.getSourceId(), startLine, endLine);

        return new FlatFileItemReaderBuilder<InputRow>()
                .name("inputRowReader-" + startLine + "-" + endLine)
                .resource(resourceLoader.getResource(run.getSource().location()))
                .encoding(StandardCharsets.UTF_8.name())
                .linesToSkip(startLine - 1)                        // title, header and preceding lines
                .maxItemCount(Math.max(0, endLine - startLine + 1))
                .lineMapper(new InputRowLineMapper(properties.getInput().getDelimiter(), run.getSource().columns(),
                        run.getManualPackageCount(), run.getManualWeightKg()))
                .build();
    }

    @Bean
    @StepScope
    public ShipmentItemProcessor shipmentItemProcessor(@Value("#{stepExecution.jobExecutionId}") Long jobExecutionId) {
        return new ShipmentItemProcessor(addressNormalizer, addressAbbreviator, recordBuilder,
                runRegistry.require(jobExecutionId));
    }

    /**
     * Step-scoped writer: each partition worker gets its own pair of report files, so concurrent
     * workers never share a file.
     */
    @Bean
    @StepScope
    public PreparedShipmentWriter workerItemWriter(
            @Value("#{stepExecution.jobExecutionId}") Long jobExecutionId,
            @Value("#{stepExecutionContext['partition'] ?: 0}") int partition) {
        return new PreparedShipmentWriter(properties.getOutput().getDir(), partition, runRegistry.require(jobExecutionId));
    }

    // ─── Upload and close-work-day ───────────────────────────────────────────

    @Bean
    public Step uploadStep() {
        return new StepBuilder("uploadStep", jobRepository)
                .tasklet(new ShipmentUploadTasklet(runRegistry, duplicateTracker, batchUploader, carrierGateway, jobExplorer),
                        transactionManager)
                .build();
    }

    @Bean
    public CloseWorkDayDecider closeWorkDayDecider() {
        return new CloseWorkDayDecider(runRegistry);
    }

    @Bean
    public Step closeWorkDayStep() {
        return new StepBuilder("closeWorkDayStep", jobRepository)
                .tasklet(new CloseWorkDayTasklet(runRegistry, batchUploader, properties.getCarrier().getSite()),
                        transactionManager)
                .build();
    }
}
