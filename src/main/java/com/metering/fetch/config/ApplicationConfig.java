package com.metering.fetch.config;

import com.metering.fetch.jobs.BackoffPolicy;
import com.metering.fetch.routing.RequestRouter;
import com.metering.fetch.upstream.PaginatedFetcher;
import com.metering.fetch.upstream.RestUpstreamClient;
import com.metering.fetch.upstream.UpstreamClient;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RequestRouter requestRouter(FetchProperties properties) {
        FetchProperties.Routing routing = properties.getRouting();
        return new RequestRouter(routing.getSamplesPerDay(), routing.getSmallThreshold(), routing.getLargeThreshold());
    }

    @Bean
    public BackoffPolicy backoffPolicy(FetchProperties properties) {
        return new BackoffPolicy(properties.getQueue().getBaseDelay(), properties.getQueue().getMaxDelay());
    }

    /**
     * JDK HttpClient based so that interrupting a timed-out fetch aborts the in-flight exchange.
     */
    @Bean
    public RestClient upstreamRestClient(RestClient.Builder builder, FetchProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(properties.getUpstream().getConnectTimeout())
            .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getUpstream().getJobTimeout());
        return builder
            .baseUrl(properties.getUpstream().getBaseUrl())
            .requestFactory(requestFactory)
            .build();
    }

    @Bean
    @ConditionalOnMissingBean(UpstreamClient.class)
    public UpstreamClient upstreamClient(RestClient upstreamRestClient, CircuitBreakerRegistry circuitBreakerRegistry) {
        return new RestUpstreamClient(upstreamRestClient, circuitBreakerRegistry);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService upstreamFetchExecutor() {
        AtomicInteger threadIndex = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "upstream-fetch-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public PaginatedFetcher paginatedFetcher(
            UpstreamClient upstreamClient,
            ExecutorService upstreamFetchExecutor,
            FetchProperties properties,
            MeterRegistry meterRegistry) {
        return new PaginatedFetcher(upstreamClient, upstreamFetchExecutor,
            properties.getUpstream().getPageSize(), properties.getUpstream().getMaxPages(), meterRegistry);
    }

    @Bean
    public Executor cacheWriteExecutor(FetchProperties properties) {
        if (!properties.getCache().isAsyncWrites()) {
            return new SyncTaskExecutor();
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("cache-write-");
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
