package com.eventanalytics.pipeline.output;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Hour partition of the persisted log, derived from an event's own timestamp in UTC.
 * <p>
 * Layout: {@code {root}/{YYYY}/{MM}/{DD}/events_{YYYY}-{MM}-{DD}-{HH}.jsonl}
 */
public record PartitionKey(int year, int month, int day, int hour) {

    public static PartitionKey of(Instant timestamp) {
        ZonedDateTime utc = timestamp.atZone(ZoneOffset.UTC);
        return new PartitionKey(utc.getYear(), utc.getMonthValue(), utc.getDayOfMonth(), utc.getHour());
    }

    public Path directory(Path root) {
        return root.resolve(String.format("%04d", year))
                .resolve(String.format("%02d", month))
                .resolve(String.format("%02d", day));
    }

    public String fileName() {
        return "events_" + this + ".jsonl";
    }

    public Path file(Path root) {
        return directory(root).resolve(fileName());
    }

    @Override
    public String toString() {
        return String.format("%04d-%02d-%02d-%02d", year, month, day, hour);
    }
}
