/**
 * Main application class for the label storage engine
 *
 * Features:
 * - Loads category tables and object store configuration at startup
 * - Runs a storage migration when started with --migrate.storage
 * - Maps --migrate.mode, --migrate.dry-run and --migrate.obj-list onto migration options
 * - Exits non-zero when the run cannot start
 */

package com.shadowcollector.label_storage;

import com.shadowcollector.label_storage.migration.MigrationOrchestrator;
import com.shadowcollector.label_storage.types.MigrationMode;
import com.shadowcollector.label_storage.types.MigrationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@SpringBootApplication
public class LabelStorageApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(LabelStorageApplication.class);

    static final String DEFAULT_OBJECT_LIST = "/app/logs/obj.json";

    private final ObjectProvider<MigrationOrchestrator> migrationOrchestrator;

    public LabelStorageApplication(ObjectProvider<MigrationOrchestrator> migrationOrchestrator) {
        this.migrationOrchestrator = migrationOrchestrator;
    }

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(LabelStorageApplication.class, args);
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("migrate.storage")) {
            return;
        }
        MigrationOrchestrator orchestrator = migrationOrchestrator.getIfAvailable();
        if (orchestrator == null) {
            String message = "MigrationOrchestrator bean is required for --migrate.storage but is not initialized. Is s3.enabled=true?";
            log.error(message);
            throw new IllegalStateException(message);
        }
        orchestrator.run(parseOptions(args));
    }

    static MigrationOptions parseOptions(ApplicationArguments args) {
        String rawMode = firstOptionValue(args, "migrate.mode");
        MigrationMode mode = rawMode == null
            ? MigrationMode.BULK_LISTING
            : MigrationMode.fromOptionValue(rawMode).orElseThrow(() -> new IllegalArgumentException(
                "Unknown --migrate.mode '" + rawMode + "', expected one of " + modeNames()));

        boolean dryRun = parseFlag(args, "migrate.dry-run");

        String objectList = firstOptionValue(args, "migrate.obj-list");
        Path objectListPath = Path.of(objectList == null || objectList.isBlank() ? DEFAULT_OBJECT_LIST : objectList.trim());

        return new MigrationOptions(mode, dryRun, mode == MigrationMode.BULK_LISTING ? objectListPath : null);
    }

    private static boolean parseFlag(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return false;
        }
        String value = firstOptionValue(args, name);
        return value == null || value.isBlank() || Boolean.parseBoolean(value.trim());
    }

    private static String firstOptionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return (values == null || values.isEmpty()) ? null : values.get(0);
    }

    private static String modeNames() {
        return Arrays.stream(MigrationMode.values())
            .map(MigrationMode::optionValue)
            .collect(Collectors.joining(", "));
    }
}
