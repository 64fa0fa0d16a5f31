package com.labelbridge.shipmentprocessor.batch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.partition.support.Partitioner;
import org.springframework.batch.item.ExecutionContext;

import java.util.HashMap;
import java.util.Map;

/**
 * Splits the data lines of the input file into {@code gridSize} contiguous line ranges.
 *
 * <p>Each partition is an {@link ExecutionContext} with {@code startLine} and {@code endLine}
 * (physical 1-based line numbers, inclusive) and its {@code partition} index. Unlike a plain CSV,
 * a shipment export may carry a title row above the header, so the first data line is passed in.
 */
@Slf4j
public class RangePartitioner implements Partitioner {

    private final int totalLines;
    private final int firstDataLine;

    public RangePartitioner(int totalLines, int firstDataLine) {
        this.totalLines = totalLines;
        this.firstDataLine = firstDataLine;
    }

    @Override
    public Map<String, ExecutionContext> partition(int gridSize) {
        Map<String, ExecutionContext> partitions = new HashMap<>();
        if (totalLines <= 0) {
            log.info("No data lines to partition");
            return partitions;
        }
        int linesPerPartition = (int) Math.ceil((double) totalLines / gridSize);
        int lastLine = firstDataLine + totalLines - 1;

        for (int i = 0; i < gridSize; i++) {
            int startLine = firstDataLine + i * linesPerPartition;
            if (startLine > lastLine) break;
            int endLine = Math.min(startLine + linesPerPartition - 1, lastLine);

            ExecutionContext ctx = new ExecutionContext();
            ctx.putInt("startLine", startLine);
            ctx.putInt("endLine", endLine);
            ctx.putInt("partition", i);

            String partitionName = "partition-" + i;
            partitions.put(partitionName, ctx);
            log.debug("Partition '{}': lines {}-{}", partitionName, startLine, endLine);
        }

        log.info("Created {} partitions for {} data lines starting at line {} (gridSize requested: {})",
                partitions.size(), totalLines, firstDataLine, gridSize);
        return partitions;
    }
}
