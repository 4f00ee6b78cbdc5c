package com.metering.fetch.storage.blob;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
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

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link BlobStore} backed by an S3-compatible bucket (AWS, MinIO, R2).
 */
public class S3BlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(S3BlobStore.class);

    private final S3Client s3Client;
    private final String bucket;

    public S3BlobStore(S3Client s3Client, String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
    }

    @Override
    public Optional<BlobObject> get(String key) {
        try {
            ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build());
            GetObjectResponse response = bytes.response();
            BlobMetadata metadata = new BlobMetadata(
                response.contentType(), response.contentEncoding(), response.metadata());
            return Optional.of(new BlobObject(key, bytes.asByteArray(), metadata));
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        }
    }

    @Override
    public Optional<BlobSummary> head(String key) {
        try {
            HeadObjectResponse response = s3Client.headObject(HeadObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build());
            BlobMetadata metadata = new BlobMetadata(
                response.contentType(), response.contentEncoding(), response.metadata());
            long size = response.contentLength() == null ? 0L : response.contentLength();
            return Optional.of(new BlobSummary(key, size, response.lastModified(), metadata));
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public void put(String key, byte[] body, BlobMetadata metadata) {
        PutObjectRequest.Builder request = PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .contentType(metadata.contentType())
            .metadata(metadata.customMetadata());
        if (metadata.contentEncoding() != null) {
            request.contentEncoding(metadata.contentEncoding());
        }
        s3Client.putObject(request.build(), RequestBody.fromBytes(body));
        log.debug("Stored s3://{}/{} ({} bytes)", bucket, key, body.length);
    }

    @Override
    public void delete(String key) {
        s3Client.deleteObject(DeleteObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .build());
    }

    @Override
    public BlobListing list(String prefix, String cursor, int limit) {
        ListObjectsV2Response response = s3Client.listObjectsV2(ListObjectsV2Request.builder()
            .bucket(bucket)
            .prefix(prefix)
            .continuationToken(cursor)
            .maxKeys(limit)
            .build());

        List<BlobSummary> objects = response.contents().stream()
            .map(object -> new BlobSummary(object.key(), object.size() == null ? 0L : object.size(),
                object.lastModified(), null))
            .collect(Collectors.toList());

        String next = Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
        return new BlobListing(objects, next);
    }

    @Override
    public boolean isHealthy() {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            return true;
        } catch (SdkException e) {
            log.warn("S3 bucket {} unreachable: {}", bucket, e.getMessage());
            return false;
        }
    }
}
