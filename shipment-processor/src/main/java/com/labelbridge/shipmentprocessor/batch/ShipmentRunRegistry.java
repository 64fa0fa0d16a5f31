package com.labelbridge.shipmentprocessor.batch;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live {@link ShipmentRun}s keyed by job execution id. A run is registered before its first
 * step and removed once the job has finished.
 */
@Component
public class ShipmentRunRegistry {

    private final Map<Long, ShipmentRun> runs = new ConcurrentHashMap<>();

    public void register(ShipmentRun run) {
        runs.put(run.getJobExecutionId(), run);
    }

    public Optional<ShipmentRun> find(Long jobExecutionId) {
        return jobExecutionId == null ? Optional.empty() : Optional.ofNullable(runs.get(jobExecutionId));
    }

    public ShipmentRun require(Long jobExecutionId) {
        return find(jobExecutionId).orElseThrow(() ->
                new IllegalStateException("No live shipment run for job execution " + jobExecutionId));
    }

    public void unregister(Long jobExecutionId) {
        runs.remove(jobExecutionId);
    }
}
