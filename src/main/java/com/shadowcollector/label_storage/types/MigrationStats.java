/**
 * Snapshot of migration counters for one run
 *
 * Features:
 * - Immutable copy handed out by the stats tracker
 * - Duration available once the run has been completed
 * - Map view for structured logging
 */

package com.shadowcollector.label_storage.types;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class MigrationStats {
    private final int total;
    private final int migrated;
    private final int skipped;
    private final int errors;
    private final int reclassified;
    private final Instant startTime;
    private final Instant endTime;

    public MigrationStats(int total, int migrated, int skipped, int errors, int reclassified,
                          Instant startTime, Instant endTime) {
        this.total = total;
        this.migrated = migrated;
        this.skipped = skipped;
        this.errors = errors;
        this.reclassified = reclassified;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public int getTotal() {
        return total;
    }

    public int getMigrated() {
        return migrated;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getErrors() {
        return errors;
    }

    public int getReclassified() {
        return reclassified;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Optional<Duration> getDuration() {
        return getEndTime().map(end -> Duration.between(startTime, end));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total", total);
        map.put("migrated", migrated);
        map.put("skipped", skipped);
        map.put("errors", errors);
        map.put("reclassified", reclassified);
        getDuration().ifPresent(d -> map.put("durationMillis", d.toMillis()));
        return map;
    }

    @Override
    public String toString() {
        return "MigrationStats{" +
               "total=" + total +
               ", migrated=" + migrated +
               ", skipped=" + skipped +
               ", errors=" + errors +
               ", reclassified=" + reclassified +
               ", startTime=" + startTime +
               (endTime != null ? ", endTime=" + endTime : "") +
               '}';
    }
}
