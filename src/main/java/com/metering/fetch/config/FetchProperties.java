package com.metering.fetch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Externalized configuration for the fetch service.
 * Maps to 'fetch.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "fetch")
public class FetchProperties {

    private Routing routing = new Routing();
    private Upstream upstream = new Upstream();
    private Cache cache = new Cache();
    private Queue queue = new Queue();
    private Worker worker = new Worker();
    private Jobs jobs = new Jobs();
    private Analytics analytics = new Analytics();
    private BlobStore blobStore = new BlobStore();

    @Data
    public static class Routing {
        private long samplesPerDay = 100L;
        private long smallThreshold = 1_000L;
        private long largeThreshold = 100_000L;
    }

    @Data
    public static class Upstream {
        private String baseUrl = "http://localhost:9090";
        private int pageSize = 100_000;
        private int maxPages = 100;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration directTimeout = Duration.ofSeconds(30);
        private Duration jobTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class Cache {
        private boolean compressionEnabled = true;
        private Duration maxCacheAge = Duration.ofHours(24);
        private Duration cleanupInterval = Duration.ofHours(1);
        private boolean asyncWrites = true;  // write-behind on the cached route
    }

    @Data
    public static class Queue {
        private String backend = "memory";
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private Duration visibilityTimeout = Duration.ofMinutes(15);
        private int batchSize = 10;
        private Duration pollInterval = Duration.ofSeconds(1);
    }

    @Data
    public static class Worker {
        private boolean enabled = true;
        private int concurrency = 4;
    }

    @Data
    public static class Jobs {
        private Duration retention = Duration.ofDays(7);
        private Duration recentCompletionWindow = Duration.ofHours(1);
        private Duration pollIntervalHint = Duration.ofSeconds(5);
        private Duration archiveInterval = Duration.ofHours(1);
        private boolean housekeepingEnabled = true;
    }

    @Data
    public static class Analytics {
        private Duration retention = Duration.ofDays(30);
    }

    @Data
    public static class BlobStore {
        private String backend = "memory";
        private S3 s3 = new S3();

        @Data
        public static class S3 {
            private String bucket = "timeseries-cache";
            private String region = "us-east-1";
            private String endpoint;
            private String accessKey;
            private String secretKey;
            private boolean pathStyleAccess = false;
        }
    }
}
