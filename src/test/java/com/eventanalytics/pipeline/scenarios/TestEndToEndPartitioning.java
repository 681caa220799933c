package com.eventanalytics.pipeline.scenarios;

import com.eventanalytics.pipeline.analytics.MinuteCount;
import com.eventanalytics.pipeline.analytics.MinuteWindowQuery;
import com.eventanalytics.pipeline.consumer.BatchDrainLoop;
import com.eventanalytics.pipeline.engine.PageViewIngestService;
import com.eventanalytics.pipeline.metrics.MetricsRegistry;
import com.eventanalytics.pipeline.output.PartitionedFileWriter;
import com.eventanalytics.pipeline.queue.InMemoryEventQueue;
import com.eventanalytics.pipeline.state.InMemoryMinuteBucketCounter;
import com.eventanalytics.pipeline.status.PartitionFileInfo;
import com.eventanalytics.pipeline.status.PipelineStatus;
import com.eventanalytics.pipeline.status.PipelineStatusReporter;
import com.eventanalytics.pipeline.testutil.MutableClock;
import com.eventanalytics.pipeline.testutil.TestFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.task.SyncTaskExecutor;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Events flow from ingestion through the queue into hour files, while the minute
 * counter answers the recent window.
 */
public class TestEndToEndPartitioning {

    @TempDir
    Path root;

    @Test
    public void testIngestedEventsAreCountedAndPersistedByHour() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-15T15:00:30Z"));
        MetricsRegistry metrics = new MetricsRegistry();
        InMemoryMinuteBucketCounter counter = new InMemoryMinuteBucketCounter(clock, 300);
        InMemoryEventQueue queue = new InMemoryEventQueue(clock, 30_000);
        PartitionedFileWriter writer = TestFactory.writer(root, clock);
        writer.initialize();
        PageViewIngestService ingest = new PageViewIngestService(counter, queue, TestFactory.codec(),
                metrics, clock, new SyncTaskExecutor());
        BatchDrainLoop loop = TestFactory.drainLoop(queue, writer, metrics, 1000);

        ingest.submit(TestFactory.pageView("u1", Instant.parse("2024-01-15T14:58:10Z")));
        ingest.submit(TestFactory.pageView("u1", Instant.parse("2024-01-15T14:58:20Z")));
        ingest.submit(TestFactory.pageView("u2", Instant.parse("2024-01-15T14:59:59Z")));
        ingest.submit(TestFactory.pageView("u3", Instant.parse("2024-01-15T15:00:05Z")));

        assertThat(loop.drainOnce()).isEqualTo(4);

        // Persistence: 3 + 1 lines split at the hour
        PipelineStatusReporter reporter = new PipelineStatusReporter(loop, writer);
        List<PartitionFileInfo> files = reporter.listFiles();
        assertThat(files).extracting(PartitionFileInfo::path).containsExactly(
                "2024/01/15/events_2024-01-15-14.jsonl", "2024/01/15/events_2024-01-15-15.jsonl");
        assertThat(files).extracting(PartitionFileInfo::eventCount).containsExactly(3L, 1L);

        PipelineStatus status = reporter.report();
        assertThat(status.queueLength()).isZero();
        assertThat(status.pendingMessages()).isZero();
        assertThat(status.filesCount()).isEqualTo(2);

        // Counting: by event minute, every event counted, users distinct
        List<MinuteCount> recent = new MinuteWindowQuery(counter, clock).recentMinutes(5);
        assertThat(recent).filteredOn(c -> c.bucketKey().equals("page_view_2024-01-15_14:58"))
                .singleElement()
                .satisfies(c -> {
                    assertThat(c.count()).isEqualTo(2);
                    assertThat(c.distinctUsers()).isEqualTo(1);
                });
        assertThat(recent).extracting(MinuteCount::count).containsExactly(0L, 0L, 0L, 2L, 1L, 1L);

        assertThat(metrics.snapshot().eventsAccepted()).isEqualTo(4);
        assertThat(metrics.snapshot().recordsPersisted()).isEqualTo(4);
        assertThat(metrics.snapshot().partitionsWritten()).isEqualTo(2);
    }
}
