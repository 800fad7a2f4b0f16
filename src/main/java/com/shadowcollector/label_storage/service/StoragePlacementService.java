/**
 * Service for writing labeled files into category directories
 * - Resolves labels to one or more categories
 * - Writes the file and its metadata JSON under every resolved category
 * - Falls back to the flat 未分类/ directory when nothing resolves
 * - Writes sequentially and stops at the first failure without rolling back
 */

package com.shadowcollector.label_storage.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadowcollector.label_storage.category.CategoryResolver;
import com.shadowcollector.label_storage.monitoring.MetricsService;
import com.shadowcollector.label_storage.types.CategoryInfo;
import com.shadowcollector.label_storage.types.PlacementResult;
import com.shadowcollector.label_storage.types.PlacementResult.PlacedPaths;
import com.shadowcollector.label_storage.types.StorageType;
import com.shadowcollector.label_storage.util.S3Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

@Service
@ConditionalOnProperty(prefix = "s3", name = "enabled", havingValue = "true")
public class StoragePlacementService {
    private static final Logger logger = LoggerFactory.getLogger(StoragePlacementService.class);

    private static final String METADATA_CONTENT_TYPE = "application/json";
    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    private final ObjectStore objectStore;
    private final CategoryResolver categoryResolver;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MetricsService metricsService;

    public StoragePlacementService(ObjectStore objectStore,
                                   CategoryResolver categoryResolver,
                                   ObjectMapper objectMapper,
                                   Clock clock,
                                   @Autowired(required = false) MetricsService metricsService) {
        this.objectStore = objectStore;
        this.categoryResolver = categoryResolver;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metricsService = metricsService;
    }

    /**
     * Stores a file and its metadata under every category its labels resolve to.
     *
     * @param type workflow the file belongs to
     * @param filename object name, kept as the last key segment
     * @param bytes file content
     * @param mimeType content type of the file
     * @param metadata object serialized as the companion JSON
     * @param labels annotation labels, may be {@code null}
     * @return paths of the first category, plus all written paths when more than one category was written
     * @throws ObjectStoreException when a write fails; earlier writes stay in place
     */
    public PlacementResult place(StorageType type,
                                 String filename,
                                 byte[] bytes,
                                 String mimeType,
                                 Object metadata,
                                 List<String> labels) {
        List<CategoryInfo> categories = labels == null || labels.isEmpty()
            ? List.of()
            : categoryResolver.resolve(labels);
        if (categories.isEmpty()) {
            categories = List.of(CategoryInfo.FLAT_UNCLASSIFIED);
        }

        byte[] metadataBytes = serialize(metadata);
        String month = YearMonth.now(clock).format(MONTH_FORMAT);
        String metadataName = S3Paths.stripExtension(filename) + ".json";

        List<PlacedPaths> written = new ArrayList<>(categories.size());
        for (CategoryInfo category : categories) {
            String basePath = type.pathSegment() + "/" + month + "/" + category.toPathFragment();
            String filePath = basePath + "/" + filename;
            String metadataPath = basePath + "/" + metadataName;

            objectStore.put(filePath, bytes, mimeType);
            objectStore.put(metadataPath, metadataBytes, METADATA_CONTENT_TYPE);
            logger.info("Stored {} and {}", filePath, metadataPath);
            written.add(new PlacedPaths(filePath, metadataPath, category));
        }

        if (metricsService != null) {
            metricsService.incrementPlacements(written.size());
        }
        PlacedPaths primary = written.get(0);
        return new PlacementResult(primary.filePath(), primary.metadataPath(), written.size() > 1 ? written : null);
    }

    private byte[] serialize(Object metadata) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(metadata)
                .getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata cannot be serialized to JSON: " + e.getOriginalMessage(), e);
        }
    }
}
