/**
 * Service for tracking migration and object store metrics
 * Provides counters and timers for monitoring
 */

package com.shadowcollector.label_storage.monitoring;

import com.shadowcollector.label_storage.types.RecordType;
import com.shadowcollector.label_storage.util.ErrorHandlingUtils.ErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter objectStoreErrors;
    private final Counter placements;

    // Timers
    private final Timer objectStoreOperationTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.objectStoreErrors = Counter.builder("storage.objectstore.errors")
            .description("Number of failed object store calls")
            .register(meterRegistry);

        this.placements = Counter.builder("storage.placements")
            .description("Number of files placed under category directories")
            .register(meterRegistry);

        this.objectStoreOperationTimer = Timer.builder("storage.objectstore.operations")
            .description("Object store call duration")
            .register(meterRegistry);
    }

    public void recordOutcome(RecordType outcome) {
        Counter.builder("storage.migration.outcomes")
            .description("Per-pair migration outcomes")
            .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
            .register(meterRegistry)
            .increment();
    }

    public void incrementFailure(ErrorCategory category) {
        Counter.builder("storage.migration.failures")
            .description("Per-pair failures by category")
            .tag("category", category.name().toLowerCase(Locale.ROOT))
            .register(meterRegistry)
            .increment();
    }

    public void incrementObjectStoreError() {
        objectStoreErrors.increment();
    }

    public void incrementPlacements(int count) {
        placements.increment(count);
    }

    public Timer.Sample startObjectStoreTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopObjectStoreTimer(Timer.Sample sample) {
        sample.stop(objectStoreOperationTimer);
    }
}
