package com.shadowcollector.label_storage.migration;

import com.shadowcollector.label_storage.category.LabelIdTable;

import java.util.List;

/**
 * Label-bearing shape found in a metadata document.
 */
public interface LabelSource {

    List<String> labels(LabelIdTable labelIdTable);

    /** Top-level {@code labels} array. */
    record DirectLabels(List<String> values) implements LabelSource {
        public DirectLabels {
            values = List.copyOf(values);
        }

        @Override
        public List<String> labels(LabelIdTable labelIdTable) {
            return values;
        }
    }

    /** {@code rectanglelabels} collected across every element of {@code annotations}, deduplicated. */
    record AnnotationList(List<String> rectangleLabels) implements LabelSource {
        public AnnotationList {
            rectangleLabels = List.copyOf(rectangleLabels);
        }

        @Override
        public List<String> labels(LabelIdTable labelIdTable) {
            return rectangleLabels;
        }
    }

    /** Numeric {@code labelIds} translated through the label id table. */
    record LabelIdList(List<Integer> ids) implements LabelSource {
        public LabelIdList {
            ids = List.copyOf(ids);
        }

        @Override
        public List<String> labels(LabelIdTable labelIdTable) {
            return labelIdTable.labelsFor(ids);
        }
    }
}
