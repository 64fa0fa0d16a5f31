package com.labelbridge.shipmentprocessor.batch;

import com.labelbridge.shipmentprocessor.upload.BatchUploader;
import com.labelbridge.shipmentprocessor.upload.WorkDayClosure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;

/**
 * Confirms every open shipment of the carrier site, making its labels final for pickup.
 */
@Slf4j
@RequiredArgsConstructor
public class CloseWorkDayTasklet implements Tasklet {

    private final ShipmentRunRegistry runRegistry;
    private final BatchUploader uploader;
    private final String site;

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        Long jobExecutionId = chunkContext.getStepContext().getStepExecution().getJobExecutionId();
        WorkDayClosure closure = uploader.closeWorkDay(site);
        log.info("Work day closed for site {}: {} shipment(s) confirmed", closure.site(), closure.closedShipments());
        runRegistry.find(jobExecutionId).ifPresent(run -> run.recordWorkDayClosure(closure));
        return RepeatStatus.FINISHED;
    }
}
