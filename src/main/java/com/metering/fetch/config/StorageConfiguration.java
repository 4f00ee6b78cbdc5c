package com.metering.fetch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metering.fetch.cache.ObjectCacheStore;
import com.metering.fetch.dlq.DeadLetterMessage;
import com.metering.fetch.jobs.JobMessage;
import com.metering.fetch.queue.DeadLetterReason;
import com.metering.fetch.queue.DeadLetterSink;
import com.metering.fetch.queue.Delivery;
import com.metering.fetch.queue.DurableQueue;
import com.metering.fetch.queue.InMemoryDurableQueue;
import com.metering.fetch.queue.JpaDurableQueue;
import com.metering.fetch.storage.blob.BlobStore;
import com.metering.fetch.storage.blob.InMemoryBlobStore;
import com.metering.fetch.storage.blob.S3BlobStore;
import com.metering.fetch.storage.jpa.CacheMetadataJpaRepository;
import com.metering.fetch.storage.jpa.QueueMessageJpaRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.time.Clock;

/**
 * Object store, cache and queue transports.
 *
 * Backends are chosen with {@code fetch.blob-store.backend} ({@code memory} or {@code s3})
 * and {@code fetch.queue.backend} ({@code memory} or {@code database}).
 */
@Configuration
public class StorageConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StorageConfiguration.class);

    static final String JOB_QUEUE = "timeseries-jobs";
    static final String DEAD_LETTER_QUEUE = "timeseries-jobs-dlq";

    // The dead-letter queue itself never dead-letters; a message it cannot deliver is dropped with a log line.
    private static final int DLQ_MAX_DELIVERIES = 5;

    @Bean
    @ConditionalOnProperty(prefix = "fetch.blob-store", name = "backend", havingValue = "memory", matchIfMissing = true)
    public BlobStore inMemoryBlobStore(Clock clock) {
        log.info("Using in-memory blob store");
        return new InMemoryBlobStore(clock);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "fetch.blob-store", name = "backend", havingValue = "s3")
    public S3Client s3Client(FetchProperties properties) {
        FetchProperties.BlobStore.S3 s3 = properties.getBlobStore().getS3();
        S3ClientBuilder builder = S3Client.builder()
            .region(Region.of(s3.getRegion()))
            .serviceConfiguration(S3Configuration.builder()
                .pathStyleAccessEnabled(s3.isPathStyleAccess())
                .build());
        if (s3.getAccessKey() != null && s3.getSecretKey() != null) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                AwsBasicCredentials.create(s3.getAccessKey(), s3.getSecretKey())));
        } else {
            builder.credentialsProvider(DefaultCredentialsProvider.create());
        }
        if (s3.getEndpoint() != null && !s3.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(s3.getEndpoint()));
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "fetch.blob-store", name = "backend", havingValue = "s3")
    public BlobStore s3BlobStore(S3Client s3Client, FetchProperties properties) {
        String bucket = properties.getBlobStore().getS3().getBucket();
        log.info("Using S3 blob store, bucket={}", bucket);
        return new S3BlobStore(s3Client, bucket);
    }

    @Bean
    public ObjectCacheStore objectCacheStore(
            BlobStore blobStore,
            CacheMetadataJpaRepository cacheMetadataRepository,
            Clock clock,
            FetchProperties properties,
            MeterRegistry meterRegistry) {
        FetchProperties.Cache cache = properties.getCache();
        return new ObjectCacheStore(blobStore, cacheMetadataRepository, clock, cache.isCompressionEnabled(),
            cache.getMaxCacheAge(), meterRegistry);
    }

    @Bean
    @ConditionalOnProperty(prefix = "fetch.queue", name = "backend", havingValue = "memory", matchIfMissing = true)
    public DurableQueue<DeadLetterMessage> inMemoryDeadLetterQueue(Clock clock, FetchProperties properties) {
        return new InMemoryDurableQueue<>(DEAD_LETTER_QUEUE, clock, properties.getQueue().getVisibilityTimeout(),
            DLQ_MAX_DELIVERIES, StorageConfiguration::dropDeadLetter);
    }

    @Bean
    @ConditionalOnProperty(prefix = "fetch.queue", name = "backend", havingValue = "memory", matchIfMissing = true)
    public DurableQueue<JobMessage> inMemoryJobQueue(
            DurableQueue<DeadLetterMessage> deadLetterQueue,
            Clock clock,
            FetchProperties properties) {
        log.info("Using in-memory job queue");
        return new InMemoryDurableQueue<>(JOB_QUEUE, clock, properties.getQueue().getVisibilityTimeout(),
            properties.getQueue().getMaxRetries(), forwardTo(deadLetterQueue, clock));
    }

    @Bean
    @ConditionalOnProperty(prefix = "fetch.queue", name = "backend", havingValue = "database")
    public DurableQueue<DeadLetterMessage> databaseDeadLetterQueue(
            QueueMessageJpaRepository repository,
            ObjectMapper objectMapper,
            Clock clock,
            FetchProperties properties) {
        return new JpaDurableQueue<>(DEAD_LETTER_QUEUE, DeadLetterMessage.class, repository, objectMapper, clock,
            properties.getQueue().getVisibilityTimeout(), DLQ_MAX_DELIVERIES, StorageConfiguration::dropDeadLetter);
    }

    @Bean
    @ConditionalOnProperty(prefix = "fetch.queue", name = "backend", havingValue = "database")
    public DurableQueue<JobMessage> databaseJobQueue(
            DurableQueue<DeadLetterMessage> deadLetterQueue,
            QueueMessageJpaRepository repository,
            ObjectMapper objectMapper,
            Clock clock,
            FetchProperties properties) {
        log.info("Using database-backed job queue");
        return new JpaDurableQueue<>(JOB_QUEUE, JobMessage.class, repository, objectMapper, clock,
            properties.getQueue().getVisibilityTimeout(), properties.getQueue().getMaxRetries(),
            forwardTo(deadLetterQueue, clock));
    }

    private static DeadLetterSink<JobMessage> forwardTo(DurableQueue<DeadLetterMessage> deadLetterQueue, Clock clock) {
        return (delivery, reason) -> deadLetterQueue.send(DeadLetterMessage.from(delivery, reason, clock.instant()));
    }

    private static void dropDeadLetter(
            Delivery<DeadLetterMessage> delivery,
            DeadLetterReason reason) {
        log.error("Dropping dead-letter message for job {} after {} deliveries: {}",
            delivery.body().jobId(), delivery.attempt(), reason.error());
    }
}
