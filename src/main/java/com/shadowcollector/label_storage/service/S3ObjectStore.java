/**
 * Object store backed by an S3 compatible bucket
 * - Reads, writes, copies and deletes single objects synchronously
 * - Flattens ListObjectsV2 pagination for prefix listings
 * - Probes the bucket with HeadBucket before a run
 * - Wraps SDK failures in store exceptions and counts them
 */

package com.shadowcollector.label_storage.service;

import com.shadowcollector.label_storage.monitoring.MetricsService;
import com.shadowcollector.label_storage.types.ObjectEntry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

public class S3ObjectStore implements ObjectStore {
    private static final Logger logger = LoggerFactory.getLogger(S3ObjectStore.class);

    private static final int HTTP_NOT_FOUND = 404;

    private final S3Client s3Client;
    private final String bucketName;
    private final MetricsService metricsService;

    /**
     * @param s3Client client configured for the target endpoint
     * @param bucketName bucket every key is resolved against
     * @param metricsService optional, may be {@code null}
     */
    public S3ObjectStore(S3Client s3Client, String bucketName, MetricsService metricsService) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        this.metricsService = metricsService;
    }

    public String getBucketName() {
        return bucketName;
    }

    @Override
    public byte[] get(String key) {
        return call("get", key, () -> {
            try {
                ResponseBytes<GetObjectResponse> objectBytes = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                        .bucket(bucketName)
                        .key(key)
                        .build());
                logger.debug("Fetched {} ({} bytes) from bucket {}", key, objectBytes.asByteArray().length, bucketName);
                return objectBytes.asByteArray();
            } catch (NoSuchKeyException e) {
                throw new ObjectNotFoundException(key, e);
            }
        });
    }

    @Override
    public void put(String key, byte[] bytes, String contentType) {
        call("put", key, () -> {
            s3Client.putObject(PutObjectRequest.builder()
                    .bucket(bucketName)
                    .key(key)
                    .contentType(contentType)
                    .build(), RequestBody.fromBytes(bytes));
            logger.debug("Uploaded {} ({} bytes, {}) to bucket {}", key, bytes.length, contentType, bucketName);
            return null;
        });
    }

    @Override
    public void copy(String sourceKey, String destinationKey) {
        call("copy", sourceKey, () -> {
            try {
                s3Client.copyObject(CopyObjectRequest.builder()
                        .sourceBucket(bucketName)
                        .sourceKey(sourceKey)
                        .destinationBucket(bucketName)
                        .destinationKey(destinationKey)
                        .build());
            } catch (NoSuchKeyException e) {
                throw new ObjectNotFoundException(sourceKey, e);
            }
            logger.debug("Copied {} to {}", sourceKey, destinationKey);
            return null;
        });
    }

    @Override
    public void delete(String key) {
        call("delete", key, () -> {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucketName)
                    .key(key)
                    .build());
            logger.debug("Deleted {}", key);
            return null;
        });
    }

    @Override
    public boolean exists(String key) {
        return call("exists", key, () -> {
            try {
                s3Client.headObject(HeadObjectRequest.builder().bucket(bucketName).key(key).build());
                return true;
            } catch (NoSuchKeyException e) {
                return false;
            } catch (S3Exception e) {
                if (e.statusCode() == HTTP_NOT_FOUND) {
                    return false;
                }
                throw e;
            }
        });
    }

    @Override
    public List<ObjectEntry> list(String prefix) {
        return list(prefix, null);
    }

    @Override
    public List<ObjectEntry> list(String prefix, String delimiter) {
        return call("list", prefix, () -> {
            List<ObjectEntry> entries = new ArrayList<>();
            String continuationToken = null;
            do {
                ListObjectsV2Request.Builder requestBuilder = ListObjectsV2Request.builder()
                        .bucket(bucketName)
                        .continuationToken(continuationToken);
                if (prefix != null && !prefix.isEmpty()) {
                    requestBuilder.prefix(prefix);
                }
                if (delimiter != null && !delimiter.isEmpty()) {
                    requestBuilder.delimiter(delimiter);
                }

                ListObjectsV2Response response = s3Client.listObjectsV2(requestBuilder.build());
                for (S3Object object : response.contents()) {
                    entries.add(new ObjectEntry(object.key(), null, object.size(),
                            object.lastModified() != null ? object.lastModified().toString() : null));
                }
                continuationToken = response.nextContinuationToken();
                logger.debug("Fetched a page of {} object(s) for prefix '{}'. More pages to fetch: {}",
                        response.contents().size(), prefix, continuationToken != null);
            } while (continuationToken != null);

            logger.info("Listed {} object(s) under prefix '{}'", entries.size(), prefix);
            return entries;
        });
    }

    @Override
    public void checkConnection() {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
            logger.info("Connected to bucket {}", bucketName);
        } catch (S3Exception e) {
            String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            logger.error("Bucket {} is not reachable (status {}): {}", bucketName, e.statusCode(), detail);
            throw new ConnectivityException("Bucket " + bucketName + " is not reachable: " + detail, e);
        } catch (SdkException e) {
            logger.error("Object store is not reachable: {}", e.getMessage());
            throw new ConnectivityException("Object store is not reachable: " + e.getMessage(), e);
        }
    }

    private <T> T call(String operation, String key, Supplier<T> action) {
        Timer.Sample sample = metricsService != null ? metricsService.startObjectStoreTimer() : null;
        try {
            return action.get();
        } catch (ObjectNotFoundException e) {
            throw e;
        } catch (SdkException e) {
            if (metricsService != null) {
                metricsService.incrementObjectStoreError();
            }
            logger.error("Object store {} failed for key {}: {}", operation, key, e.getMessage());
            throw new ObjectStoreException("Object store " + operation + " failed for key " + key + ": " + e.getMessage(), key, e);
        } finally {
            if (sample != null) {
                metricsService.stopObjectStoreTimer(sample);
            }
        }
    }
}
