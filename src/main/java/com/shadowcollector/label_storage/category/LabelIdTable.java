package com.shadowcollector.label_storage.category;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Numeric label id to label string mapping used by the classify workflow's metadata.
 */
public final class LabelIdTable {

    private static final Logger logger = LoggerFactory.getLogger(LabelIdTable.class);

    private final Map<Integer, String> labelsById;

    public LabelIdTable(Map<Integer, String> labelsById) {
        this.labelsById = Collections.unmodifiableMap(new LinkedHashMap<>(labelsById));
    }

    public Optional<String> labelFor(int id) {
        return Optional.ofNullable(labelsById.get(id));
    }

    /**
     * Translates ids in order, skipping ids with no mapping.
     */
    public List<String> labelsFor(List<Integer> ids) {
        List<String> labels = new ArrayList<>();
        if (ids == null) {
            return labels;
        }
        for (Integer id : ids) {
            if (id == null) {
                continue;
            }
            String label = labelsById.get(id);
            if (label != null) {
                labels.add(label);
            } else {
                logger.warn("Unknown label ID: {}", id);
            }
        }
        return labels;
    }

    public int size() {
        return labelsById.size();
    }
}
