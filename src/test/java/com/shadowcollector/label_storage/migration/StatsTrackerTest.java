package com.shadowcollector.label_storage.migration;

import com.shadowcollector.label_storage.types.MigrationStats;
import com.shadowcollector.label_storage.types.RecordType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StatsTrackerTest {

    private static final Instant START = Instant.parse("2026-10-18T10:00:00Z");

    @Test
    void everyOutcomeCountsTowardsTotal() {
        StatsTracker tracker = new StatsTracker(Clock.fixed(START, ZoneOffset.UTC));

        tracker.record(RecordType.MIGRATED);
        tracker.record(RecordType.MIGRATED);
        tracker.record(RecordType.SKIPPED);
        tracker.record(RecordType.ERROR);
        tracker.record(RecordType.RECLASSIFIED);

        MigrationStats stats = tracker.getStats();
        assertThat(stats.getTotal()).isEqualTo(5);
        assertThat(stats.getMigrated()).isEqualTo(2);
        assertThat(stats.getSkipped()).isEqualTo(1);
        assertThat(stats.getErrors()).isEqualTo(1);
        assertThat(stats.getReclassified()).isEqualTo(1);
        assertThat(stats.getTotal())
            .isEqualTo(stats.getMigrated() + stats.getSkipped() + stats.getErrors() + stats.getReclassified());
        assertThat(stats.getStartTime()).isEqualTo(START);
        assertThat(stats.getEndTime()).isEmpty();
        assertThat(stats.getDuration()).isEmpty();
    }

    @Test
    void summaryOmitsReclassifiedAndDurationUntilPresent() {
        StatsTracker tracker = new StatsTracker(Clock.fixed(START, ZoneOffset.UTC));
        tracker.record(RecordType.MIGRATED);

        assertThat(tracker.summary()).isEqualTo(String.join("\n",
            StatsTracker.BANNER,
            "Migration Summary",
            StatsTracker.BANNER,
            "Total files: 1",
            "Migrated: 1",
            "Skipped: 0",
            "Errors: 0",
            StatsTracker.BANNER));
    }

    @Test
    void completedRunReportsDuration() {
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(START, START.plusMillis(2500));
        StatsTracker tracker = new StatsTracker(clock);
        tracker.record(RecordType.RECLASSIFIED);

        tracker.complete();

        assertThat(tracker.getStats().getDuration()).contains(Duration.ofMillis(2500));
        assertThat(tracker.summary())
            .contains("Reclassified: 1")
            .contains("Duration: 2.50s")
            .endsWith(StatsTracker.BANNER);
        assertThat(tracker.getStats().toMap())
            .containsEntry("total", 1)
            .containsEntry("durationMillis", 2500L);
    }
}
