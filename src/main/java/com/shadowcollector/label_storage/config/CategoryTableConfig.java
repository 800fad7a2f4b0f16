/**
 * Loads the category lookup tables once at startup
 *
 * Features:
 * - Reads the classes CSV and label id JSON from configured resource locations
 * - Refuses to start when either source is unset, missing or malformed
 * - Exposes the immutable tables and the resolver and extractor built on them
 */

package com.shadowcollector.label_storage.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadowcollector.label_storage.category.CategoryConfigurationException;
import com.shadowcollector.label_storage.category.CategoryResolver;
import com.shadowcollector.label_storage.category.CategoryTable;
import com.shadowcollector.label_storage.category.CategoryTableLoader;
import com.shadowcollector.label_storage.category.LabelIdTable;
import com.shadowcollector.label_storage.category.PrefixTable;
import com.shadowcollector.label_storage.migration.LabelExtractor;
import com.shadowcollector.label_storage.types.TableLoadResult;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class CategoryTableConfig {

    @Bean
    public CategoryTableLoader categoryTableLoader(ObjectMapper objectMapper) {
        return new CategoryTableLoader(objectMapper);
    }

    @Bean
    public CategoryTable categoryTable(CategoryTableLoader loader,
                                       CategoryConfigurationProperties properties,
                                       ResourceLoader resourceLoader) {
        Resource resource = resolve(resourceLoader, properties.getClassesLocation(), "storage.category.classes-location");
        return requireLoaded(loader.loadCategoryTable(resource), "category table");
    }

    @Bean
    public LabelIdTable labelIdTable(CategoryTableLoader loader,
                                     CategoryConfigurationProperties properties,
                                     ResourceLoader resourceLoader) {
        Resource resource = resolve(resourceLoader, properties.getLabelIdMapLocation(), "storage.category.label-id-map-location");
        return requireLoaded(loader.loadLabelIdTable(resource), "label ID table");
    }

    @Bean
    public PrefixTable prefixTable() {
        return PrefixTable.defaults();
    }

    @Bean
    public CategoryResolver categoryResolver(CategoryTable categoryTable, PrefixTable prefixTable) {
        return new CategoryResolver(categoryTable, prefixTable);
    }

    @Bean
    public LabelExtractor labelExtractor(ObjectMapper objectMapper, LabelIdTable labelIdTable) {
        return new LabelExtractor(objectMapper, labelIdTable);
    }

    private static Resource resolve(ResourceLoader resourceLoader, String location, String propertyName) {
        if (location == null || location.isBlank()) {
            throw new CategoryConfigurationException(propertyName + " is not configured");
        }
        return resourceLoader.getResource(location.trim());
    }

    private static <T> T requireLoaded(TableLoadResult<T> result, String description) {
        return result.getTable().orElseThrow(() -> new CategoryConfigurationException(
            "Failed to load " + description + " from " + result.getSource() + ": "
                + result.getErrorMessage().orElse(result.getStatus().name())));
    }
}
