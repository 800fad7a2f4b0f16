package com.shadowcollector.label_storage.migration;

import com.shadowcollector.label_storage.types.MigrationStats;
import com.shadowcollector.label_storage.types.RecordType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Per-run outcome counters. Every recorded outcome also increments the total.
 */
public class StatsTracker {

    static final String BANNER = "==========================================";

    private final Clock clock;
    private final Instant startTime;
    private Instant endTime;

    private int total;
    private int migrated;
    private int skipped;
    private int errors;
    private int reclassified;

    public StatsTracker(Clock clock) {
        this.clock = clock;
        this.startTime = clock.instant();
    }

    public void record(RecordType type) {
        total++;
        switch (type) {
            case MIGRATED:
                migrated++;
                break;
            case SKIPPED:
                skipped++;
                break;
            case ERROR:
                errors++;
                break;
            case RECLASSIFIED:
                reclassified++;
                break;
            default:
                throw new IllegalArgumentException("Unsupported record type: " + type);
        }
    }

    public void complete() {
        endTime = clock.instant();
    }

    public MigrationStats getStats() {
        return new MigrationStats(total, migrated, skipped, errors, reclassified, startTime, endTime);
    }

    public String summary() {
        List<String> lines = new ArrayList<>();
        lines.add(BANNER);
        lines.add("Migration Summary");
        lines.add(BANNER);
        lines.add("Total files: " + total);
        lines.add("Migrated: " + migrated);
        lines.add("Skipped: " + skipped);
        lines.add("Errors: " + errors);
        if (reclassified > 0) {
            lines.add("Reclassified: " + reclassified);
        }
        if (endTime != null) {
            double seconds = Duration.between(startTime, endTime).toMillis() / 1000.0;
            lines.add(String.format(Locale.ROOT, "Duration: %.2fs", seconds));
        }
        lines.add(BANNER);
        return String.join("\n", lines);
    }
}
