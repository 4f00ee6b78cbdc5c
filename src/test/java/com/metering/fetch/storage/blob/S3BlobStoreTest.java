package com.metering.fetch.storage.blob;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
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

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("S3BlobStore Tests")
class S3BlobStoreTest {

    private S3Client s3Client;
    private S3BlobStore store;

    @BeforeEach
    void setUp() {
        s3Client = mock(S3Client.class);
        store = new S3BlobStore(s3Client, "timeseries-cache");
    }

    @Test
    @DisplayName("Should map object bytes and headers")
    void testGet() {
        GetObjectResponse response = GetObjectResponse.builder()
            .contentType("application/json")
            .contentEncoding("gzip")
            .metadata(Map.of("generated-time", "2025-03-01T00:00:00Z"))
            .build();
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenReturn(ResponseBytes.fromByteArray(response, "{}".getBytes(StandardCharsets.UTF_8)));

        BlobObject object = store.get("timeseries/a.json").orElseThrow();

        assertThat(object.size()).isEqualTo(2);
        assertThat(object.metadata().contentEncoding()).isEqualTo("gzip");
        assertThat(object.metadata().custom("generated-time")).isEqualTo("2025-03-01T00:00:00Z");
    }

    @Test
    @DisplayName("Should treat missing keys as absent")
    void testMissing() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenThrow(NoSuchKeyException.builder().message("missing").build());
        when(s3Client.headObject(any(HeadObjectRequest.class)))
            .thenThrow(S3Exception.builder().statusCode(404).message("Not Found").build());

        assertThat(store.get("k")).isEmpty();
        assertThat(store.head("k")).isEmpty();
    }

    @Test
    @DisplayName("Should propagate other S3 errors from head")
    void testHeadFailure() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
            .thenThrow(S3Exception.builder().statusCode(403).message("Forbidden").build());

        assertThatThrownBy(() -> store.head("k")).isInstanceOf(S3Exception.class);
    }

    @Test
    @DisplayName("Should send content type, encoding and custom metadata on put")
    void testPut() {
        store.put("k", new byte[] {1, 2, 3}, new BlobMetadata("application/json", "gzip", Map.of("site", "plant-7")));

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
        assertThat(captor.getValue().bucket()).isEqualTo("timeseries-cache");
        assertThat(captor.getValue().contentEncoding()).isEqualTo("gzip");
        assertThat(captor.getValue().metadata()).containsEntry("site", "plant-7");
    }

    @Test
    @DisplayName("Should return the continuation token only for truncated listings")
    void testList() {
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(ListObjectsV2Response.builder()
            .contents(S3Object.builder().key("timeseries/a").size(10L).build())
            .isTruncated(true)
            .nextContinuationToken("token-2")
            .build());

        BlobListing listing = store.list("timeseries/", null, 1);

        assertThat(listing.objects()).extracting(BlobSummary::key).containsExactly("timeseries/a");
        assertThat(listing.nextCursor()).isEqualTo("token-2");
    }

    @Test
    @DisplayName("Should report unreachable buckets as unhealthy")
    void testHealth() {
        when(s3Client.headBucket(any(HeadBucketRequest.class)))
            .thenThrow(SdkClientException.create("connection refused"));

        assertThat(store.isHealthy()).isFalse();
    }
}
