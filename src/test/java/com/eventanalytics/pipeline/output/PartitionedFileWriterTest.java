package com.eventanalytics.pipeline.output;

import com.eventanalytics.pipeline.exception.FatalConfigException;
import com.eventanalytics.pipeline.queue.PageViewEventCodec;
import com.eventanalytics.pipeline.queue.QueueEntry;
import com.eventanalytics.pipeline.testutil.MutableClock;
import com.eventanalytics.pipeline.testutil.TestFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PartitionedFileWriterTest {

    private static final Instant QUEUED_AT = Instant.parse("2024-01-15T15:00:02Z");

    @TempDir
    Path root;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-15T15:00:05Z"));
    private final PageViewEventCodec codec = TestFactory.codec();
    private final ObjectMapper mapper = TestFactory.objectMapper();
    private PartitionedFileWriter writer;

    @BeforeEach
    void setUp() {
        writer = TestFactory.writer(root, clock);
        writer.initialize();
    }

    /**
     * Three events in 14:xx and one in 15:xx land in two files, 3 + 1 lines.
     */
    @Test
    void testBatchIsSplitByEventHour() throws IOException {
        List<QueueEntry> batch = List.of(
                entry("1-0", "u1", "2024-01-15T14:01:00Z"),
                entry("1-1", "u2", "2024-01-15T15:00:01Z"),
                entry("1-2", "u3", "2024-01-15T14:30:00Z"),
                entry("1-3", "u4", "2024-01-15T14:59:59Z"));

        BatchWriteResult result = writer.writeBatch(batch);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.recordsWritten()).isEqualTo(4);
        assertThat(result.partitionsWritten()).isEqualTo(2);
        assertThat(lines(root.resolve("2024/01/15/events_2024-01-15-14.jsonl"))).hasSize(3);
        assertThat(lines(root.resolve("2024/01/15/events_2024-01-15-15.jsonl"))).hasSize(1);
    }

    @Test
    void testLinesKeepArrivalOrderAndCarryMetadata() throws IOException {
        writer.writeBatch(List.of(
                entry("1-0", "u1", "2024-01-15T14:01:00Z"),
                entry("1-1", "u2", "2024-01-15T14:00:30Z")));

        List<String> lines = lines(root.resolve("2024/01/15/events_2024-01-15-14.jsonl"));
        JsonNode first = mapper.readTree(lines.get(0));
        JsonNode second = mapper.readTree(lines.get(1));

        assertThat(first.get("queue_entry_id").asText()).isEqualTo("1-0");
        assertThat(second.get("queue_entry_id").asText()).isEqualTo("1-1");
        assertThat(first.get("processed_at").asText()).isEqualTo("2024-01-15T15:00:05Z");
        assertThat(first.get("user_id").asText()).isEqualTo("u1");
        assertThat(first.get("payload").get("page_url").asText()).isEqualTo("https://example.com/home");
        assertThat(first.has("timestamp_parse_error")).isFalse();
        assertThat(first.has("partitionTime")).isFalse();
    }

    @Test
    void testFilesAreOnlyAppendedTo() throws IOException {
        writer.writeBatch(List.of(entry("1-0", "u1", "2024-01-15T14:01:00Z")));
        writer.writeBatch(List.of(entry("1-0", "u1", "2024-01-15T14:01:00Z")));

        // the same entry written twice, as after a redelivery
        assertThat(lines(root.resolve("2024/01/15/events_2024-01-15-14.jsonl"))).hasSize(2);
        assertThat(writer.getRecordsWritten()).isEqualTo(2);
    }

    @Test
    void testUnparseableTimestampIsPartitionedByQueuedAtAndFlagged() throws IOException {
        writer.writeBatch(List.of(entry("1-0", "u1", "not-a-date")));

        List<String> lines = lines(root.resolve("2024/01/15/events_2024-01-15-15.jsonl"));
        assertThat(lines).hasSize(1);
        assertThat(mapper.readTree(lines.get(0)).get("timestamp_parse_error").asBoolean()).isTrue();
    }

    /**
     * A partition that cannot be written does not stop the other partitions of the batch.
     */
    @Test
    void testFailedPartitionIsReportedAndOthersAreWritten() throws IOException {
        // a directory where the 14:00 file should be
        Files.createDirectories(root.resolve("2024/01/15/events_2024-01-15-14.jsonl"));

        BatchWriteResult result = writer.writeBatch(List.of(
                entry("1-0", "u1", "2024-01-15T14:01:00Z"),
                entry("1-1", "u2", "2024-01-15T15:00:01Z")));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.failedPartitions()).containsExactly("2024-01-15-14");
        assertThat(result.recordsWritten()).isEqualTo(1);
        assertThat(lines(root.resolve("2024/01/15/events_2024-01-15-15.jsonl"))).hasSize(1);
    }

    @Test
    void testUncreatableRootIsFatal() throws IOException {
        Path blocker = Files.createFile(root.resolve("blocker"));
        PartitionedFileWriter blocked = TestFactory.writer(blocker.resolve("events"), clock);

        assertThatThrownBy(blocked::initialize).isInstanceOf(FatalConfigException.class);
    }

    private QueueEntry entry(String id, String user, String timestamp) {
        Map<String, String> fields = new LinkedHashMap<>(codec.encode(
                TestFactory.pageView(user, Instant.parse("2024-01-15T14:00:00Z")), QUEUED_AT));
        fields.put(PageViewEventCodec.TIMESTAMP, timestamp);
        return new QueueEntry(id, fields);
    }

    private static List<String> lines(Path file) throws IOException {
        return Files.readAllLines(file);
    }
}
