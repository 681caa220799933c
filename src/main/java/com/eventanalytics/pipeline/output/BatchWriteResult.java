package com.eventanalytics.pipeline.output;

import java.util.List;

/**
 * Outcome of writing one drained batch.
 *
 * @param batchSize         entries in the batch
 * @param recordsWritten    records appended to partition files
 * @param partitionsWritten partition files fully appended
 * @param failedPartitions  partitions whose append failed, empty on success
 */
public record BatchWriteResult(int batchSize,
                               int recordsWritten,
                               int partitionsWritten,
                               List<String> failedPartitions) {

    public BatchWriteResult {
        failedPartitions = List.copyOf(failedPartitions);
    }

    public boolean isSuccess() {
        return failedPartitions.isEmpty();
    }
}
