package com.eventanalytics.pipeline.api;

import com.eventanalytics.pipeline.status.PartitionFileInfo;
import com.eventanalytics.pipeline.status.PipelineStatus;
import com.eventanalytics.pipeline.status.PipelineStatusReporter;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the persistence side: drain loop state and partition files.
 */
@RestController
@RequestMapping("/persistent")
@RequiredArgsConstructor
public class PersistenceController {

    private final PipelineStatusReporter reporter;
    private final Clock clock;

    @GetMapping("/status")
    public StatusResponse status() {
        PipelineStatus stats = reporter.report();
        return new StatusResponse(stats.processorRunning() ? "healthy" : "stopped", stats, clock.instant());
    }

    @GetMapping("/files")
    public FilesResponse files() {
        List<PartitionFileInfo> files = reporter.listFiles();
        long totalBytes = files.stream().mapToLong(PartitionFileInfo::sizeBytes).sum();
        return new FilesResponse(files, files.size(), Math.round(totalBytes / (1024d * 1024d) * 100) / 100.0);
    }

    public record StatusResponse(
            @JsonProperty("status") String status,
            @JsonProperty("stats") PipelineStatus stats,
            @JsonProperty("timestamp") Instant timestamp
    ) {}

    public record FilesResponse(
            @JsonProperty("files") List<PartitionFileInfo> files,
            @JsonProperty("total_files") int totalFiles,
            @JsonProperty("total_size_mb") double totalSizeMb
    ) {}
}
