package com.eventanalytics.pipeline.status;

import com.eventanalytics.pipeline.consumer.BatchDrainLoop;
import com.eventanalytics.pipeline.consumer.DrainLoopStats;
import com.eventanalytics.pipeline.output.PartitionedFileWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Read-only aggregation of queue figures and partition file statistics.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineStatusReporter {

    private static final String PARTITION_FILE_SUFFIX = ".jsonl";
    private static final double BYTES_PER_MB = 1024d * 1024d;

    private final BatchDrainLoop drainLoop;
    private final PartitionedFileWriter writer;

    /**
     * Never throws for an unreachable queue: the failure is reported in {@code error}.
     */
    public PipelineStatus report() {
        Long queueLength = null;
        Long pending = null;
        String error = null;
        try {
            DrainLoopStats stats = drainLoop.stats();
            queueLength = stats.queueLength();
            pending = stats.pendingCount();
        } catch (RuntimeException e) {
            log.error("Failed to get queue stats", e);
            error = e.getMessage();
        }

        long filesCount = 0;
        long totalBytes = 0;
        for (Path file : partitionFiles()) {
            try {
                totalBytes += Files.size(file);
                filesCount++;
            } catch (IOException e) {
                log.warn("Cannot stat partition file {}: {}", file, e.getMessage());
            }
        }
        return new PipelineStatus(queueLength, pending, drainLoop.isRunning(),
                filesCount, totalBytes, toMb(totalBytes), error);
    }

    /**
     * Every partition file with its size and line count, sorted by path relative to the root.
     */
    public List<PartitionFileInfo> listFiles() {
        Path root = writer.getRoot();
        List<PartitionFileInfo> files = new ArrayList<>();
        for (Path file : partitionFiles()) {
            try {
                long size = Files.size(file);
                files.add(new PartitionFileInfo(
                        root.relativize(file).toString().replace('\\', '/'),
                        size,
                        toMb(size),
                        Files.getLastModifiedTime(file).toInstant(),
                        countLines(file)
                ));
            } catch (IOException e) {
                log.warn("Cannot stat partition file {}: {}", file, e.getMessage());
            }
        }
        files.sort(Comparator.comparing(PartitionFileInfo::path));
        return files;
    }

    private List<Path> partitionFiles() {
        Path root = writer.getRoot();
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(PARTITION_FILE_SUFFIX))
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.error("Failed to scan partition files under {}", root, e);
            return List.of();
        }
    }

    private static long countLines(Path file) {
        try (Stream<String> lines = Files.lines(file)) {
            return lines.count();
        } catch (IOException | UncheckedIOException e) {
            return -1;
        }
    }

    private static double toMb(long bytes) {
        return Math.round(bytes / BYTES_PER_MB * 100) / 100.0;
    }
}
