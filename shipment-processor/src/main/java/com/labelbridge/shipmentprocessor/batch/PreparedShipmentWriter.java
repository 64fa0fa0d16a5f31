package com.labelbridge.shipmentprocessor.batch;

import com.labelbridge.shipmentprocessor.domain.PreparedShipment;
import com.labelbridge.shipmentprocessor.domain.ProcessedRow;
import com.labelbridge.shipmentprocessor.domain.RejectedRow;
import com.labelbridge.shipmentprocessor.domain.ShipmentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.ItemStreamWriter;
import org.springframework.batch.item.file.FlatFileItemWriter;
import org.springframework.batch.item.file.builder.FlatFileItemWriterBuilder;
import org.springframework.batch.item.file.transform.BeanWrapperFieldExtractor;
import org.springframework.batch.item.file.transform.DelimitedLineAggregator;
import org.springframework.batch.item.file.transform.FieldExtractor;
import org.springframework.core.io.FileSystemResource;

import java.io.File;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stages prepared shipments on the {@link ShipmentRun} and writes two report files per partition:
 * <ul>
 *   <li><b>prepared-p{partition}-{timestamp}.csv</b>: the carrier record as it will be sent</li>
 *   <li><b>rejected-p{partition}-{timestamp}.csv</b>: line, failure kind, detail and suggested fix</li>
 * </ul>
 * Files are {@code ;}-separated because addresses routinely contain commas.
 *
 * <p>Not annotated with {@code @Component}: created as a {@code @StepScope} bean so that each
 * partition worker gets its own writer and output files.
 */
@Slf4j
public class PreparedShipmentWriter implements ItemStreamWriter<ProcessedRow> {

    static final String DELIMITER = ";";

    private static final String[] PREPARED_FIELDS = {
            "lineNumber", "reference", "recipientName", "address", "locality", "province", "postalCode",
            "packageCount", "weightKg", "notes", "phone", "email", "fingerprint"
    };

    private static final String[] REJECTED_FIELDS = {
            "lineNumber", "ordinal", "recipientName", "address", "city", "postalCode", "kind", "detail", "suggestion"
    };

    private final String outputDir;
    private final int partitionIndex;
    private final ShipmentRun run;

    private FlatFileItemWriter<PreparedShipment> preparedWriter;
    private FlatFileItemWriter<RejectedRow> rejectedWriter;

    private final AtomicLong preparedCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();

    public PreparedShipmentWriter(String outputDir, int partitionIndex, ShipmentRun run) {
        this.outputDir = outputDir;
        this.partitionIndex = partitionIndex;
        this.run = run;
    }

    @Override
    public void open(ExecutionContext executionContext) throws ItemStreamException {
        File dir = new File(outputDir);
        if (!dir.exists() && !dir.mkdirs()) {
            throw new ItemStreamException("Cannot create output directory " + dir.getAbsolutePath());
        }

        String suffix = run.getSourceId() + "-p" + partitionIndex + "-" + System.currentTimeMillis();
        preparedWriter = buildWriter(new File(dir, "prepared-" + suffix + ".csv"), PREPARED_FIELDS,
                preparedExtractor(), "preparedWriter-" + suffix);
        rejectedWriter = buildWriter(new File(dir, "rejected-" + suffix + ".csv"), REJECTED_FIELDS,
                rejectedExtractor(), "rejectedWriter-" + suffix);

        preparedWriter.open(executionContext);
        rejectedWriter.open(executionContext);

        log.info("Partition {} output: prepared-{}.csv | rejected-{}.csv", partitionIndex, suffix, suffix);
    }

    @Override
    public void write(Chunk<? extends ProcessedRow> chunk) throws Exception {
        List<PreparedShipment> prepared = chunk.getItems().stream()
                .filter(ProcessedRow::isPrepared)
                .map(ProcessedRow::prepared)
                .toList();
        List<RejectedRow> rejected = chunk.getItems().stream()
                .filter(r -> !r.isPrepared())
                .map(ProcessedRow::rejected)
                .toList();

        if (!prepared.isEmpty()) {
            preparedWriter.write(new Chunk<>(prepared));
            prepared.forEach(run::stage);
            preparedCount.addAndGet(prepared.size());
        }
        if (!rejected.isEmpty()) {
            rejectedWriter.write(new Chunk<>(rejected));
            rejected.forEach(r -> run.rejected(r.getKind()));
            rejectedCount.addAndGet(rejected.size());
        }
    }

    @Override
    public void close() throws ItemStreamException {
        if (preparedWriter != null) preparedWriter.close();
        if (rejectedWriter != null) rejectedWriter.close();
        log.info("Partition {} done: {} prepared, {} rejected", partitionIndex, preparedCount.get(), rejectedCount.get());
    }

    @Override
    public void update(ExecutionContext executionContext) throws ItemStreamException {
        if (preparedWriter != null) preparedWriter.update(executionContext);
        if (rejectedWriter != null) rejectedWriter.update(executionContext);
    }

    // ─── helpers ─────────────────────────────────────────────────────────────

    private static FieldExtractor<PreparedShipment> preparedExtractor() {
        return item -> {
            ShipmentRecord s = item.shipment();
            return new Object[]{
                    item.lineNumber(), s.getReference(), s.getRecipientName(), s.getAddress(), s.getLocality(),
                    s.getProvince(), s.getPostalCode(), s.getPackageCount(), s.getWeightKg(), s.getNotes(),
                    s.getPhone(), s.getEmail(), item.fingerprint()
            };
        };
    }

    private static FieldExtractor<RejectedRow> rejectedExtractor() {
        BeanWrapperFieldExtractor<RejectedRow> extractor = new BeanWrapperFieldExtractor<>();
        extractor.setNames(REJECTED_FIELDS);
        return extractor;
    }

    private static <T> FlatFileItemWriter<T> buildWriter(File file, String[] fields,
                                                         FieldExtractor<T> extractor, String name) {
        DelimitedLineAggregator<T> aggregator = new DelimitedLineAggregator<>();
        aggregator.setDelimiter(DELIMITER);
        aggregator.setFieldExtractor(extractor);

        return new FlatFileItemWriterBuilder<T>()
                .name(name)
                .resource(new FileSystemResource(file))
                .encoding("UTF-8")
                .lineAggregator(aggregator)
                .headerCallback(writer -> writer.write(String.join(DELIMITER, fields)))
                .append(false)
                .build();
    }
}
