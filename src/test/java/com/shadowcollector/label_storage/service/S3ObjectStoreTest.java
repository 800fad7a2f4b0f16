package com.shadowcollector.label_storage.service;

import com.shadowcollector.label_storage.monitoring.MetricsService;
import com.shadowcollector.label_storage.types.ObjectEntry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class S3ObjectStoreTest {

    @Mock
    private S3Client s3Client;
    private SimpleMeterRegistry meterRegistry;
    private S3ObjectStore objectStore;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        objectStore = new S3ObjectStore(s3Client, "shadow-collector", new MetricsService(meterRegistry));
    }

    @Test
    void testGet_returnsObjectBytes() {
        byte[] content = "{\"labels\": []}".getBytes(StandardCharsets.UTF_8);
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), content));

        assertArrayEquals(content, objectStore.get("detection/a.json"));

        ArgumentCaptor<GetObjectRequest> captor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObjectAsBytes(captor.capture());
        assertEquals("shadow-collector", captor.getValue().bucket());
        assertEquals("detection/a.json", captor.getValue().key());
        assertEquals(1L, meterRegistry.get("storage.objectstore.operations").timer().count());
    }

    @Test
    void testGet_missingKeyIsNotFound() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenThrow(NoSuchKeyException.builder().message("missing").build());

        ObjectNotFoundException thrown = assertThrows(ObjectNotFoundException.class,
            () -> objectStore.get("detection/a.json"));
        assertEquals("detection/a.json", thrown.getKey());
        assertEquals(0.0, meterRegistry.get("storage.objectstore.errors").counter().count());
    }

    @Test
    void testPut_sdkFailureIsWrappedAndCounted() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
            .thenThrow(SdkClientException.create("connection reset"));

        ObjectStoreException thrown = assertThrows(ObjectStoreException.class,
            () -> objectStore.put("detection/a.jpg", new byte[]{1}, "image/jpeg"));
        assertFalse(thrown instanceof ObjectNotFoundException);
        assertEquals("detection/a.jpg", thrown.getKey());
        assertTrue(thrown.getCause() instanceof SdkClientException);
        assertEquals(1.0, meterRegistry.get("storage.objectstore.errors").counter().count());
    }

    @Test
    void testPut_setsContentType() {
        objectStore.put("detection/a.json", new byte[]{1}, "application/json");

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
        assertEquals("application/json", captor.getValue().contentType());
        assertEquals("detection/a.json", captor.getValue().key());
    }

    @Test
    void testCopy_usesSameBucketOnBothSides() {
        objectStore.copy("detection%2Fa.jpg", "detection/2024-01/x/y/a.jpg");

        ArgumentCaptor<CopyObjectRequest> captor = ArgumentCaptor.forClass(CopyObjectRequest.class);
        verify(s3Client).copyObject(captor.capture());
        assertEquals("shadow-collector", captor.getValue().sourceBucket());
        assertEquals("shadow-collector", captor.getValue().destinationBucket());
        assertEquals("detection%2Fa.jpg", captor.getValue().sourceKey());
        assertEquals("detection/2024-01/x/y/a.jpg", captor.getValue().destinationKey());
    }

    @Test
    void testExists_trueWhenHeadSucceeds() {
        when(s3Client.headObject(any(HeadObjectRequest.class))).thenReturn(HeadObjectResponse.builder().build());

        assertTrue(objectStore.exists("detection/a.jpg"));
    }

    @Test
    void testExists_falseOnNotFoundStatus() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
            .thenThrow((S3Exception) S3Exception.builder().statusCode(404).message("Not Found").build());

        assertFalse(objectStore.exists("detection/a.jpg"));
    }

    @Test
    void testExists_otherStatusIsAnError() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
            .thenThrow((S3Exception) S3Exception.builder().statusCode(403).message("Forbidden").build());

        assertThrows(ObjectStoreException.class, () -> objectStore.exists("detection/a.jpg"));
    }

    @Test
    void testList_followsContinuationTokens() {
        ListObjectsV2Response first = ListObjectsV2Response.builder()
            .contents(S3Object.builder().key("detection/a.jpg").size(10L).build())
            .nextContinuationToken("page-2")
            .build();
        ListObjectsV2Response second = ListObjectsV2Response.builder()
            .contents(S3Object.builder().key("detection/a.json").size(2L).build())
            .build();
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(first, second);

        List<ObjectEntry> entries = objectStore.list("detection/");

        assertEquals(2, entries.size());
        assertEquals("detection/a.jpg", entries.get(0).key());
        assertEquals(10L, entries.get(0).size());
        assertEquals("detection/a.json", entries.get(1).key());

        ArgumentCaptor<ListObjectsV2Request> captor = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(s3Client, times(2)).listObjectsV2(captor.capture());
        assertNull(captor.getAllValues().get(0).continuationToken());
        assertEquals("page-2", captor.getAllValues().get(1).continuationToken());
        assertEquals("detection/", captor.getAllValues().get(0).prefix());
        assertNull(captor.getAllValues().get(0).delimiter());
    }

    @Test
    void testList_rootWithDelimiter() {
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class)))
            .thenReturn(ListObjectsV2Response.builder().build());

        assertTrue(objectStore.list("", "/").isEmpty());

        ArgumentCaptor<ListObjectsV2Request> captor = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(s3Client).listObjectsV2(captor.capture());
        assertNull(captor.getValue().prefix());
        assertEquals("/", captor.getValue().delimiter());
    }

    @Test
    void testCheckConnection_unreachableBucket() {
        when(s3Client.headBucket(any(HeadBucketRequest.class)))
            .thenThrow((S3Exception) S3Exception.builder().statusCode(404).message("NoSuchBucket").build());

        assertThrows(ConnectivityException.class, () -> objectStore.checkConnection());
    }

    @Test
    void testCheckConnection_clientFailure() {
        when(s3Client.headBucket(any(HeadBucketRequest.class)))
            .thenThrow(SdkClientException.create("Unable to execute HTTP request"));

        ConnectivityException thrown = assertThrows(ConnectivityException.class, () -> objectStore.checkConnection());
        assertTrue(thrown.getMessage().contains("Unable to execute HTTP request"));
    }
}
