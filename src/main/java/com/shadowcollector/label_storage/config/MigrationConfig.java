/**
 * Wires the migration components
 * The clock and listing parser are always available; store-backed components need s3.enabled=true
 */

package com.shadowcollector.label_storage.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadowcollector.label_storage.category.CategoryResolver;
import com.shadowcollector.label_storage.migration.BucketScanner;
import com.shadowcollector.label_storage.migration.LabelExtractor;
import com.shadowcollector.label_storage.migration.MigrationOrchestrator;
import com.shadowcollector.label_storage.migration.ObjectListParser;
import com.shadowcollector.label_storage.migration.PathCalculator;
import com.shadowcollector.label_storage.monitoring.MetricsService;
import com.shadowcollector.label_storage.service.ObjectStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({S3ConfigurationProperties.class, CategoryConfigurationProperties.class})
public class MigrationConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public PathCalculator pathCalculator(Clock clock) {
        return new PathCalculator(clock);
    }

    @Bean
    public ObjectListParser objectListParser(ObjectMapper objectMapper) {
        return new ObjectListParser(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "s3", name = "enabled", havingValue = "true")
    public BucketScanner bucketScanner(ObjectStore objectStore) {
        return new BucketScanner(objectStore);
    }

    @Bean
    @ConditionalOnProperty(prefix = "s3", name = "enabled", havingValue = "true")
    public MigrationOrchestrator migrationOrchestrator(ObjectStore objectStore,
                                                       BucketScanner bucketScanner,
                                                       ObjectListParser objectListParser,
                                                       LabelExtractor labelExtractor,
                                                       CategoryResolver categoryResolver,
                                                       PathCalculator pathCalculator,
                                                       Clock clock,
                                                       ObjectProvider<MetricsService> metricsService) {
        return new MigrationOrchestrator(objectStore, bucketScanner, objectListParser, labelExtractor,
            categoryResolver, pathCalculator, clock, metricsService.getIfAvailable());
    }
}
