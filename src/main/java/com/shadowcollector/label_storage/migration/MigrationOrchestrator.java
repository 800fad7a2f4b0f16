/**
 * Runs storage layout migrations pair by pair
 *
 * Features:
 * - Bulk mode migrates pairs from an exported object listing
 * - Scan-all mode migrates non-compliant pairs found by a live scan
 * - Reclassify mode re-resolves pairs parked under 未分类/未分类
 * - List modes report pairs without touching storage
 * - Dry runs log intended moves and count them as a real run would
 * - Moves are resumable per object so an interrupted pair completes on rerun
 */

package com.shadowcollector.label_storage.migration;

import com.shadowcollector.label_storage.category.CategoryResolver;
import com.shadowcollector.label_storage.monitoring.MetricsService;
import com.shadowcollector.label_storage.service.ObjectNotFoundException;
import com.shadowcollector.label_storage.service.ObjectStore;
import com.shadowcollector.label_storage.types.CategoryInfo;
import com.shadowcollector.label_storage.types.FilePair;
import com.shadowcollector.label_storage.types.MigrationMode;
import com.shadowcollector.label_storage.types.MigrationOptions;
import com.shadowcollector.label_storage.types.MigrationRunResult;
import com.shadowcollector.label_storage.types.NonCompliantReport;
import com.shadowcollector.label_storage.types.ObjectEntry;
import com.shadowcollector.label_storage.types.PathViolationType;
import com.shadowcollector.label_storage.types.RecordType;
import com.shadowcollector.label_storage.util.ErrorHandlingUtils;
import com.shadowcollector.label_storage.util.S3Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class MigrationOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(MigrationOrchestrator.class);

    static final int PROGRESS_INTERVAL = 50;

    private final ObjectStore objectStore;
    private final BucketScanner bucketScanner;
    private final ObjectListParser objectListParser;
    private final LabelExtractor labelExtractor;
    private final CategoryResolver categoryResolver;
    private final PathCalculator pathCalculator;
    private final Clock clock;
    private final MetricsService metricsService;

    public MigrationOrchestrator(ObjectStore objectStore,
                                 BucketScanner bucketScanner,
                                 ObjectListParser objectListParser,
                                 LabelExtractor labelExtractor,
                                 CategoryResolver categoryResolver,
                                 PathCalculator pathCalculator,
                                 Clock clock,
                                 MetricsService metricsService) {
        this.objectStore = objectStore;
        this.bucketScanner = bucketScanner;
        this.objectListParser = objectListParser;
        this.labelExtractor = labelExtractor;
        this.categoryResolver = categoryResolver;
        this.pathCalculator = pathCalculator;
        this.clock = clock;
        this.metricsService = metricsService;
    }

    /**
     * @throws com.shadowcollector.label_storage.service.ConnectivityException when the bucket is unreachable
     * @throws IllegalArgumentException when bulk mode has no readable object listing
     */
    public MigrationRunResult run(MigrationOptions options) {
        MigrationMode mode = options.mode();
        logger.info("Starting storage migration in {} mode{}", mode.optionValue(), options.dryRun() ? " (dry run)" : "");
        objectStore.checkConnection();

        if (mode.isListOnly()) {
            return mode == MigrationMode.LIST_NON_COMPLIANT
                ? MigrationRunResult.nonCompliantListing(listNonCompliant())
                : MigrationRunResult.uncategorizedListing(listUncategorized());
        }

        if (options.dryRun()) {
            logger.warn("DRY-RUN MODE - No changes will be made");
        }

        List<FilePair> pairs;
        if (mode == MigrationMode.BULK_LISTING) {
            pairs = pairsFromListing(options.objectListPath());
        } else if (mode == MigrationMode.SCAN_ALL) {
            pairs = bucketScanner.scanNonCompliant((type, count) ->
                logger.debug("Scanned {}/: found {} non-compliant files", type, count));
            logViolationCounts(pairs);
        } else {
            pairs = bucketScanner.scanUncategorized();
        }

        StatsTracker stats = new StatsTracker(clock);
        int processed = 0;
        for (FilePair pair : pairs) {
            processPair(pair, mode, options.dryRun(), stats);
            processed++;
            if (processed % PROGRESS_INTERVAL == 0) {
                logger.info("Processed {}/{} pairs", processed, pairs.size());
            }
        }
        stats.complete();

        for (String line : stats.summary().split("\n")) {
            logger.info(line);
        }
        if (options.dryRun()) {
            logger.warn("DRY-RUN: No files were moved. Run without --migrate.dry-run to execute");
        }
        return MigrationRunResult.migrated(mode, stats.getStats());
    }

    /**
     * Processes one pair and records exactly one outcome. Failures are recorded, never thrown.
     */
    void processPair(FilePair pair, MigrationMode mode, boolean dryRun, StatsTracker stats) {
        logger.debug("Processing: {}", pair.imagePath());
        try {
            String jsonSource = pair.sourceJsonPath();
            byte[] metadata;
            try {
                metadata = objectStore.get(jsonSource);
            } catch (ObjectNotFoundException e) {
                jsonSource = locateMovedMetadata(pair).orElseThrow(() -> e);
                logger.info("Metadata for {} already moved to {}, resuming", pair.imagePath(), jsonSource);
                metadata = objectStore.get(jsonSource);
            }

            List<String> labels = labelExtractor.extract(metadata);
            logger.debug("Labels extracted: {}", labels.isEmpty() ? "(none)" : String.join(", ", labels));

            CategoryInfo category = categoryResolver.primaryCategory(labels);
            if (mode == MigrationMode.RECLASSIFY && category.isUnclassified()) {
                logger.debug("Still uncategorized: {}", pair.imagePath());
                record(stats, RecordType.SKIPPED);
                return;
            }

            String month = pathCalculator.extractMonth(pair.imagePath());
            String newImagePath = PathCalculator.calculateNewPath(pair.imagePath(), month, category);
            String newJsonPath = PathCalculator.calculateNewPath(pair.jsonPath(), month, category);

            if (PathCalculator.isCorrectLocation(pair.sourceImagePath(), newImagePath)
                    && PathCalculator.isCorrectLocation(jsonSource, newJsonPath)) {
                logger.debug("Already correct: {}", pair.imagePath());
                record(stats, RecordType.SKIPPED);
                return;
            }

            RecordType outcome = mode == MigrationMode.RECLASSIFY ? RecordType.RECLASSIFIED : RecordType.MIGRATED;
            if (dryRun) {
                if (pair.isEncoded()) {
                    logger.info("[DRY-RUN] Would move (encoded) {} (decoded {}) -> {}",
                        pair.sourceImagePath(), pair.imagePath(), newImagePath);
                } else {
                    logger.info("[DRY-RUN] Would move {} -> {}", pair.imagePath(), newImagePath);
                }
                record(stats, outcome);
                return;
            }

            moveObject(pair.sourceImagePath(), newImagePath);
            moveObject(jsonSource, newJsonPath);
            logger.info("{}: {} -> {}", outcome == RecordType.RECLASSIFIED ? "Reclassified" : "Migrated",
                pair.imagePath(), newImagePath);
            record(stats, outcome);
        } catch (RuntimeException e) {
            ErrorHandlingUtils.logFailure(logger, "processing " + pair.imagePath(), metricsService, e);
            record(stats, RecordType.ERROR);
        }
    }

    /**
     * Copy then delete. A source that is gone while the destination exists counts as already moved.
     */
    void moveObject(String sourceKey, String destinationKey) {
        if (sourceKey.equals(destinationKey)) {
            return;
        }
        if (objectStore.exists(sourceKey)) {
            objectStore.copy(sourceKey, destinationKey);
            objectStore.delete(sourceKey);
            return;
        }
        if (objectStore.exists(destinationKey)) {
            logger.info("{} already at {}, skipping move", sourceKey, destinationKey);
            return;
        }
        throw new ObjectNotFoundException(sourceKey);
    }

    NonCompliantReport listNonCompliant() {
        logger.info("Scanning for non-compliant files...");
        List<FilePair> pairs = bucketScanner.scanNonCompliant((type, count) ->
            logger.info("Scanned {}/: {} non-compliant files", type, count));
        if (pairs.isEmpty()) {
            logger.info("All files are compliant with standard path format");
            return NonCompliantReport.empty();
        }

        NonCompliantReport report = new NonCompliantReport(groupByViolation(pairs));
        logger.info("Non-compliant files by violation type:");
        report.getPairsByViolation().forEach((type, typePairs) -> {
            logger.info("[{}] ({} pairs):", type.wireName(), typePairs.size());
            for (FilePair pair : typePairs) {
                if (pair.isEncoded()) {
                    logger.info("  (encoded) {}", pair.sourceImagePath());
                    logger.info("  (decoded) {}", pair.imagePath());
                } else {
                    logger.info("  {}", pair.imagePath());
                }
            }
        });
        logger.info("Total: {} non-compliant file pairs. Run with --migrate.mode=scan-all to migrate them",
            report.getTotalPairs());
        return report;
    }

    List<FilePair> listUncategorized() {
        List<FilePair> pairs = bucketScanner.scanUncategorized();
        if (pairs.isEmpty()) {
            logger.info("No uncategorized files found");
            return pairs;
        }
        logger.info("Uncategorized files:");
        for (FilePair pair : pairs) {
            logger.info("  {}", pair.imagePath());
        }
        logger.info("Total: {} file pairs", pairs.size());
        return pairs;
    }

    /**
     * Groups pairs by the violation of the key they are read from, in first-seen order.
     */
    static Map<PathViolationType, List<FilePair>> groupByViolation(List<FilePair> pairs) {
        Map<PathViolationType, List<FilePair>> byViolation = new LinkedHashMap<>();
        for (FilePair pair : pairs) {
            PathViolationType type = PathGrammar.classify(pair.sourceImagePath());
            byViolation.computeIfAbsent(type, t -> new ArrayList<>()).add(pair);
        }
        return byViolation;
    }

    private List<FilePair> pairsFromListing(Path objectListPath) {
        if (objectListPath == null) {
            throw new IllegalArgumentException("Object list path is required in bulk mode");
        }
        if (!Files.exists(objectListPath)) {
            throw new IllegalArgumentException("Object list not found: " + objectListPath);
        }
        List<ObjectEntry> entries;
        try {
            entries = FilePairMatcher.normalizeEntries(objectListParser.parseListing(objectListPath));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read object list " + objectListPath, e);
        }
        FilePairMatcher.SeparatedKeys separated = FilePairMatcher.separate(entries);
        logger.info("Found {} images and {} JSON files", separated.images().size(), separated.jsons().size());

        List<FilePair> pairs = FilePairMatcher.pairEntries(entries);
        logger.info("Matched {} file pairs", pairs.size());
        return pairs;
    }

    private void logViolationCounts(List<FilePair> pairs) {
        logger.info("Found {} non-compliant file pairs", pairs.size());
        if (pairs.isEmpty()) {
            logger.info("All files are compliant with standard path format");
            return;
        }
        Map<PathViolationType, Integer> counts = groupByViolation(pairs).entrySet().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().size(), (a, b) -> a, LinkedHashMap::new));
        counts.forEach((type, count) -> logger.info("Violation type {}: {} pairs", type.wireName(), count));
    }

    /**
     * Finds a pair's metadata already moved into the canonical layout by an interrupted run.
     */
    private Optional<String> locateMovedMetadata(FilePair pair) {
        String prefix = PathCalculator.extractType(pair.jsonPath()) + "/"
            + pathCalculator.extractMonth(pair.imagePath()) + "/";
        String filename = S3Paths.basename(pair.jsonPath());
        List<String> candidates = objectStore.list(prefix).stream()
            .map(ObjectEntry::key)
            .filter(PathGrammar::isValid)
            .filter(key -> S3Paths.basename(key).equals(filename))
            .collect(Collectors.toList());
        if (candidates.size() == 1) {
            return Optional.of(candidates.get(0));
        }
        if (candidates.size() > 1) {
            logger.warn("Metadata {} found in {} canonical locations, not resuming", filename, candidates.size());
        }
        return Optional.empty();
    }

    private void record(StatsTracker stats, RecordType type) {
        stats.record(type);
        if (metricsService != null) {
            metricsService.recordOutcome(type);
        }
    }
}
