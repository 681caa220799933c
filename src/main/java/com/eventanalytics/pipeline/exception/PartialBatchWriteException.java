package com.eventanalytics.pipeline.exception;

import lombok.Getter;

import java.util.List;

/**
 * Some partitions of a drained batch were not written. The batch must stay unacknowledged.
 */
@Getter
public class PartialBatchWriteException extends PipelineException {

    private final List<String> failedPartitions;
    private final int batchSize;

    public PartialBatchWriteException(int batchSize, List<String> failedPartitions) {
        super("PARTIAL_BATCH_WRITE",
                "Failed to write partitions " + failedPartitions + " of a batch of " + batchSize + " entries");
        this.batchSize = batchSize;
        this.failedPartitions = List.copyOf(failedPartitions);
    }
}
