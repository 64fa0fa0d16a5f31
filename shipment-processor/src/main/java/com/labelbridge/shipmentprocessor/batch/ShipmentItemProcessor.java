package com.labelbridge.shipmentprocessor.batch;

import com.labelbridge.shipmentprocessor.address.AddressAbbreviator;
import com.labelbridge.shipmentprocessor.address.AddressNormalizer;
import com.labelbridge.shipmentprocessor.address.AddressQuery;
import com.labelbridge.shipmentprocessor.address.NormalizationResult;
import com.labelbridge.shipmentprocessor.domain.AbbreviatedAddress;
import com.labelbridge.shipmentprocessor.domain.InputRow;
import com.labelbridge.shipmentprocessor.domain.PreparedShipment;
import com.labelbridge.shipmentprocessor.domain.ProcessedRow;
import com.labelbridge.shipmentprocessor.domain.RejectedRow;
import com.labelbridge.shipmentprocessor.domain.RowFailure;
import com.labelbridge.shipmentprocessor.shipment.BuildResult;
import com.labelbridge.shipmentprocessor.shipment.Fingerprints;
import com.labelbridge.shipmentprocessor.shipment.ShipmentRecordBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ItemProcessor;

import java.util.Optional;

/**
 * Turns one {@link InputRow} into a {@link PreparedShipment} or a {@link RejectedRow}.
 *
 * <ol>
 *   <li>Blank rows are filtered (return {@code null}).</li>
 *   <li>Row checks that need no address (recipient, manual fields, phone).</li>
 *   <li>Address normalization through the geocoding provider.</li>
 *   <li>Abbreviation to carrier field widths.</li>
 *   <li>Carrier record construction and fingerprinting.</li>
 * </ol>
 * A failure at any stage becomes a rejected row carrying its {@code FailureKind}; the item is
 * never thrown away, so the writer can report it.
 *
 * <p>Not a {@code @Component}: created per partition as a {@code @StepScope} bean so that it is
 * bound to the {@link ShipmentRun} of its own job execution.
 */
@Slf4j
public class ShipmentItemProcessor implements ItemProcessor<InputRow, ProcessedRow> {

    private final AddressNormalizer normalizer;
    private final AddressAbbreviator abbreviator;
    private final ShipmentRecordBuilder recordBuilder;
    private final ShipmentRun run;

    public ShipmentItemProcessor(AddressNormalizer normalizer, AddressAbbreviator abbreviator,
                                 ShipmentRecordBuilder recordBuilder, ShipmentRun run) {
        this.normalizer = normalizer;
        this.abbreviator = abbreviator;
        this.recordBuilder = recordBuilder;
        this.run = run;
    }

    @Override
    public ProcessedRow process(InputRow row) {
        if (row.isBlank()) {
            log.debug("Line {} is blank, skipped", row.getLineNumber());
            return null;
        }

        Optional<RowFailure> precheck = recordBuilder.precheck(row, run.getLayout());
        if (precheck.isPresent()) {
            return rejected(row, precheck.get());
        }

        NormalizationResult normalized = normalizer.normalize(
                new AddressQuery(row.getAddress(), row.getCity(), row.getPostalCode(), row.getProvince()));
        if (!normalized.isSuccess()) {
            return rejected(row, normalized.failure());
        }

        AbbreviatedAddress abbreviated = abbreviator.abbreviate(normalized.address());
        BuildResult built = recordBuilder.build(row, run.getLayout(), abbreviated, run.getReferences());
        if (!built.isSuccess()) {
            return rejected(row, built.failure());
        }

        String fingerprint = Fingerprints.of(run.getSourceId(), row);
        return ProcessedRow.prepared(new PreparedShipment(fingerprint, run.getSourceId(), row.getLineNumber(), built.record()));
    }

    private ProcessedRow rejected(InputRow row, RowFailure failure) {
        log.info("Line {} rejected: {} ({})", row.getLineNumber(), failure.kind(), failure.detail());
        return ProcessedRow.rejected(RejectedRow.of(row, failure));
    }
}
