package com.labelbridge.shipmentprocessor.batch;

import com.labelbridge.shipmentprocessor.domain.FailureKind;
import com.labelbridge.shipmentprocessor.domain.PreparedShipment;
import com.labelbridge.shipmentprocessor.ledger.Admission;
import com.labelbridge.shipmentprocessor.ledger.DuplicateTracker;
import com.labelbridge.shipmentprocessor.ledger.ReconciliationReport;
import com.labelbridge.shipmentprocessor.upload.BatchUploader;
import com.labelbridge.shipmentprocessor.upload.CarrierGateway;
import com.labelbridge.shipmentprocessor.upload.UploadReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.explore.JobExplorer;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Upload step: reconcile, admit, upload.
 *
 * <ol>
 *   <li>SUBMITTED ledger entries left by an earlier, interrupted run are checked against the carrier.</li>
 *   <li>Staged shipments are offered to the {@link DuplicateTracker} in input order; those already
 *       CONFIRMED, in flight elsewhere or awaiting reconciliation are skipped. A reference that
 *       appears on two rows is rejected on its second occurrence.</li>
 *   <li>Admitted shipments go to the {@link BatchUploader}.</li>
 * </ol>
 * A stop request ({@code JobOperator.stop}) is honoured between batches: the job execution is
 * re-read before each batch.
 */
@Slf4j
public class ShipmentUploadTasklet implements Tasklet {

    private final ShipmentRunRegistry runRegistry;
    private final DuplicateTracker tracker;
    private final BatchUploader uploader;
    private final CarrierGateway carrier;
    private final JobExplorer jobExplorer;

    public ShipmentUploadTasklet(ShipmentRunRegistry runRegistry, DuplicateTracker tracker,
                                 BatchUploader uploader, CarrierGateway carrier, JobExplorer jobExplorer) {
        this.runRegistry = runRegistry;
        this.tracker = tracker;
        this.uploader = uploader;
        this.carrier = carrier;
        this.jobExplorer = jobExplorer;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        StepExecution stepExecution = chunkContext.getStepContext().getStepExecution();
        ShipmentRun run = runRegistry.require(stepExecution.getJobExecutionId());

        ReconciliationReport reconciliation = tracker.reconcile(carrier);
        run.recordReconciliation(reconciliation);

        List<PreparedShipment> admitted = new ArrayList<>();
        Set<String> references = new HashSet<>();
        for (PreparedShipment shipment : run.stagedInOrder()) {
            if (!references.add(shipment.reference())) {
                log.warn("Line {}: reference '{}' already used by an earlier row", shipment.lineNumber(), shipment.reference());
                run.rejected(FailureKind.DUPLICATE_REFERENCE);
                continue;
            }
            Admission admission = tracker.admit(shipment.fingerprint());
            if (admission.admitted()) {
                admitted.add(shipment);
            } else {
                log.debug("Line {} skipped, ledger status {}", shipment.lineNumber(), admission.previousStatus());
                run.skipped(admission.previousStatus());
            }
        }
        log.info("{} of {} staged shipments admitted for upload", admitted.size(), run.getStaged().size());

        UploadReport report = uploader.upload(admitted, () -> stopRequested(stepExecution));
        run.recordUpload(report);
        contribution.incrementWriteCount(report.getConfirmed().size());
        return RepeatStatus.FINISHED;
    }

    private boolean stopRequested(StepExecution stepExecution) {
        if (stepExecution.isTerminateOnly()) {
            return true;
        }
        JobExecution current = jobExplorer.getJobExecution(stepExecution.getJobExecutionId());
        return current != null && current.getStatus() == BatchStatus.STOPPING;
    }
}
