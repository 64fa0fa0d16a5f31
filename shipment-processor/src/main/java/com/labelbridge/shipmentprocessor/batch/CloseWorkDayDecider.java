package com.labelbridge.shipmentprocessor.batch;

import lombok.RequiredArgsConstructor;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.job.flow.FlowExecutionStatus;
import org.springframework.batch.core.job.flow.JobExecutionDecider;

/**
 * Routes to the close-work-day step when the run asked for it and confirmed at least one shipment.
 */
@RequiredArgsConstructor
public class CloseWorkDayDecider implements JobExecutionDecider {

    public static final String CLOSE = "CLOSE";
    public static final String SKIP = "SKIP";

    private final ShipmentRunRegistry runRegistry;

    @Override
    public FlowExecutionStatus decide(JobExecution jobExecution, StepExecution stepExecution) {
        boolean requested = Boolean.parseBoolean(jobExecution.getJobParameters().getString("closeWorkDay", "false"));
        long confirmed = runRegistry.find(jobExecution.getId()).map(ShipmentRun::confirmedCount).orElse(0L);
        return requested && confirmed > 0 ? new FlowExecutionStatus(CLOSE) : new FlowExecutionStatus(SKIP);
    }
}
