package com.eventanalytics.pipeline.metrics;

import java.time.Instant;

/**
 * Point-in-time copy of the ingest and drain counters.
 * {@code lastBatchAt} stays null until the first batch is persisted.
 */
public record MetricsSnapshot(

        /* -------- Ingestion -------- */
        long eventsAccepted,
        long enqueueFailures,
        long counterFailures,

        /* -------- Drain loop -------- */
        long batchesClaimed,
        long entriesClaimed,
        long recordsPersisted,
        long partitionsWritten,
        long batchWriteFailures,
        long drainLoopErrors,

        /* -------- Health -------- */
        Instant lastBatchAt,
        Instant lastUpdatedAt
) {}
