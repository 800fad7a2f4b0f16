/**
 * Loads the startup lookup tables used for label categorization
 *
 * Features:
 * - Parses the five column classes CSV into a label to category table
 * - Strips a byte order mark from the first cell and skips the header row
 * - Ignores short rows and rows with an empty label or category
 * - Parses the label id JSON object into an id to label table
 * - Reports missing or malformed sources as a typed result instead of throwing
 */

package com.shadowcollector.label_storage.category;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadowcollector.label_storage.types.CategoryInfo;
import com.shadowcollector.label_storage.types.TableLoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

public class CategoryTableLoader {

    private static final Logger logger = LoggerFactory.getLogger(CategoryTableLoader.class);

    private static final String BYTE_ORDER_MARK = "\uFEFF";
    private static final int MIN_COLUMNS = 5;
    private static final int CATEGORY1_COLUMN = 0;
    private static final int CATEGORY2_COLUMN = 1;
    private static final int LABEL_COLUMN = 4;

    private final ObjectMapper objectMapper;

    public CategoryTableLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TableLoadResult<CategoryTable> loadCategoryTable(Resource resource) {
        String source = describe(resource);
        if (resource == null || !resource.exists()) {
            logger.error("Category source not found: {}", source);
            return TableLoadResult.missing(source);
        }
        try {
            CategoryTable table = parseCategoryCsv(read(resource));
            if (table.size() == 0) {
                logger.warn("Category source {} produced no label mappings", source);
            }
            logger.info("Loaded {} label category mappings from {}", table.size(), source);
            return TableLoadResult.loaded(table, source);
        } catch (IOException e) {
            logger.error("Failed to read category source {}: {}", source, e.getMessage(), e);
            return TableLoadResult.malformed(source, e.getMessage());
        }
    }

    public TableLoadResult<LabelIdTable> loadLabelIdTable(Resource resource) {
        String source = describe(resource);
        if (resource == null || !resource.exists()) {
            logger.error("Label ID source not found: {}", source);
            return TableLoadResult.missing(source);
        }
        try {
            LabelIdTable table = parseLabelIdJson(read(resource));
            logger.info("Loaded {} label ID mappings from {}", table.size(), source);
            return TableLoadResult.loaded(table, source);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.error("Label ID source {} is not a valid JSON object: {}", source, e.getMessage());
            return TableLoadResult.malformed(source, e.getMessage());
        } catch (IOException e) {
            logger.error("Failed to read label ID source {}: {}", source, e.getMessage(), e);
            return TableLoadResult.malformed(source, e.getMessage());
        }
    }

    /**
     * Row layout: 专业, 部件名称/场景分类, 部位名称/场景名称, 状态描述/场景描述, 标注标签.
     * Later rows with the same label replace earlier ones.
     */
    public static CategoryTable parseCategoryCsv(String content) {
        Map<String, CategoryInfo> categoriesByLabel = new LinkedHashMap<>();
        if (content == null || content.isEmpty()) {
            return new CategoryTable(categoriesByLabel);
        }

        String[] lines = content.split("\n");
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] columns = line.split(",", -1);
            if (columns.length < MIN_COLUMNS) {
                continue;
            }
            String category1 = stripByteOrderMark(columns[CATEGORY1_COLUMN]).trim();
            String category2 = columns[CATEGORY2_COLUMN].trim();
            String label = columns[LABEL_COLUMN].trim();
            if (label.isEmpty() || category1.isEmpty() || category2.isEmpty()) {
                continue;
            }
            categoriesByLabel.put(label, new CategoryInfo(category1, category2));
        }
        return new CategoryTable(categoriesByLabel);
    }

    LabelIdTable parseLabelIdJson(String content) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(content);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("expected a JSON object of id to label");
        }
        Map<Integer, String> labelsById = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Integer id = parseId(field.getKey());
            JsonNode value = field.getValue();
            if (id == null || value == null || !value.isTextual() || value.asText().isEmpty()) {
                continue;
            }
            labelsById.put(id, value.asText());
        }
        return new LabelIdTable(labelsById);
    }

    private static Integer parseId(String key) {
        try {
            return Integer.valueOf(key.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String stripByteOrderMark(String cell) {
        return cell.startsWith(BYTE_ORDER_MARK) ? cell.substring(BYTE_ORDER_MARK.length()) : cell;
    }

    private static String read(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String describe(Resource resource) {
        return resource == null ? "<unset>" : resource.getDescription();
    }
}
