/**
 * Extracts annotation labels from a pair's metadata JSON
 *
 * Features:
 * - Direct labels array first
 * - Label Studio style annotations[].value.rectanglelabels second
 * - Classify workflow labelIds through the label id table last
 * - The first shape that yields labels wins
 */

package com.shadowcollector.label_storage.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadowcollector.label_storage.category.LabelIdTable;
import com.shadowcollector.label_storage.migration.LabelSource.AnnotationList;
import com.shadowcollector.label_storage.migration.LabelSource.DirectLabels;
import com.shadowcollector.label_storage.migration.LabelSource.LabelIdList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class LabelExtractor {

    private static final Logger logger = LoggerFactory.getLogger(LabelExtractor.class);

    private final ObjectMapper objectMapper;
    private final LabelIdTable labelIdTable;

    public LabelExtractor(ObjectMapper objectMapper, LabelIdTable labelIdTable) {
        this.objectMapper = objectMapper;
        this.labelIdTable = labelIdTable;
    }

    /**
     * @throws MetadataParseException when the payload is not a JSON object
     */
    public List<String> extract(byte[] metadataJson) {
        return extract(parse(metadataJson));
    }

    public List<String> extract(JsonNode metadata) {
        for (LabelSource source : sources(metadata)) {
            List<String> labels = source.labels(labelIdTable);
            if (!labels.isEmpty()) {
                logger.debug("Labels taken from {}: {}", source.getClass().getSimpleName(), labels);
                return labels;
            }
        }
        return List.of();
    }

    /**
     * Label-bearing shapes present in the document, in precedence order.
     */
    public List<LabelSource> sources(JsonNode metadata) {
        List<LabelSource> sources = new ArrayList<>();
        if (metadata == null || !metadata.isObject()) {
            return sources;
        }

        JsonNode labels = metadata.get("labels");
        if (labels != null && labels.isArray()) {
            Set<String> values = new LinkedHashSet<>();
            for (JsonNode label : labels) {
                if (label.isTextual()) {
                    values.add(label.asText());
                }
            }
            sources.add(new DirectLabels(new ArrayList<>(values)));
        }

        JsonNode annotations = metadata.get("annotations");
        if (annotations != null && annotations.isArray()) {
            Set<String> values = new LinkedHashSet<>();
            for (JsonNode annotation : annotations) {
                JsonNode rectangleLabels = annotation.path("value").path("rectanglelabels");
                if (!rectangleLabels.isArray()) {
                    continue;
                }
                for (JsonNode label : rectangleLabels) {
                    if (label.isTextual()) {
                        values.add(label.asText());
                    }
                }
            }
            sources.add(new AnnotationList(new ArrayList<>(values)));
        }

        JsonNode labelIds = metadata.get("labelIds");
        if (labelIds != null && labelIds.isArray()) {
            List<Integer> ids = new ArrayList<>();
            for (JsonNode id : labelIds) {
                if (id.isIntegralNumber()) {
                    ids.add(id.asInt());
                }
            }
            sources.add(new LabelIdList(ids));
        }
        return sources;
    }

    private JsonNode parse(byte[] metadataJson) {
        if (metadataJson == null || metadataJson.length == 0) {
            throw new MetadataParseException("Metadata is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(metadataJson);
        } catch (IOException e) {
            throw new MetadataParseException("Metadata is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MetadataParseException("Metadata is not a JSON object");
        }
        return root;
    }
}
