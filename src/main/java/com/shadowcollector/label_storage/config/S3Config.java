/**
 * Configuration for the S3 compatible object store holding labeled files
 *
 * Features:
 * - Creates the S3Client bean only when s3.enabled=true
 * - Supports a custom endpoint URL and path-style access for MinIO
 * - Fails startup when credentials or endpoint are missing
 * - Exposes the client through the ObjectStore capability
 */
package com.shadowcollector.label_storage.config;

import com.shadowcollector.label_storage.monitoring.MetricsService;
import com.shadowcollector.label_storage.service.ObjectStore;
import com.shadowcollector.label_storage.service.S3ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

@Configuration
@ConditionalOnProperty(prefix = "s3", name = "enabled", havingValue = "true")
public class S3Config {
    private static final Logger logger = LoggerFactory.getLogger(S3Config.class);

    /**
     * Creates and configures the S3Client
     * - Validates required configuration parameters before creating client
     * - Overrides endpoint for compatibility with MinIO or other S3 compatible services
     * - Uses static credentials provider for authentication
     *
     * @param properties s3.* settings
     * @return configured S3Client instance
     * @throws IllegalStateException when credentials or the endpoint are missing
     */
    @Bean(destroyMethod = "close")
    public S3Client s3Client(S3ConfigurationProperties properties) {
        if (isBlank(properties.getAccessKeyId()) || isBlank(properties.getSecretAccessKey())
                || isBlank(properties.getServerUrl())) {
            throw new IllegalStateException(
                "S3 credentials (access-key-id, secret-access-key) and server-url must be configured when s3.enabled=true");
        }

        logger.info("Configuring S3Client with server URL: {}, region: {}, path-style access: {}",
            properties.getServerUrl(), properties.getRegion(), properties.isPathStyleAccess());
        return S3Client.builder()
                .region(Region.of(properties.getRegion()))
                .endpointOverride(URI.create(properties.getServerUrl()))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(properties.isPathStyleAccess())
                        .build())
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(properties.getAccessKeyId(), properties.getSecretAccessKey())))
                .build();
    }

    @Bean
    public ObjectStore objectStore(S3Client s3Client,
                                   S3ConfigurationProperties properties,
                                   ObjectProvider<MetricsService> metricsService) {
        if (isBlank(properties.getBucketName())) {
            throw new IllegalStateException("s3.bucket-name must be configured when s3.enabled=true");
        }
        return new S3ObjectStore(s3Client, properties.getBucketName(), metricsService.getIfAvailable());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
