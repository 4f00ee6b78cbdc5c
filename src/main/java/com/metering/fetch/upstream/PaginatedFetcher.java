package com.metering.fetch.upstream;

import com.metering.fetch.domain.ErrorCategory;
import com.metering.fetch.domain.FetchResult;
import com.metering.fetch.domain.PointSeries;
import com.metering.fetch.domain.Sample;
import com.metering.fetch.exception.FetchException;
import com.metering.fetch.exception.UpstreamException;
import com.metering.fetch.exception.UpstreamTimeoutException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Drains the upstream cursor for one request and groups samples per point.
 *
 * Pagination continues while the upstream reports {@code has_more} with a non-empty
 * cursor, up to {@code maxPages} pages. Hitting the ceiling with data remaining marks
 * the result truncated. The whole loop runs under one cumulative deadline; when it
 * expires the running page request is interrupted and an
 * {@link UpstreamTimeoutException} is raised.
 */
public class PaginatedFetcher {

    private static final Logger log = LoggerFactory.getLogger(PaginatedFetcher.class);

    private final UpstreamClient client;
    private final ExecutorService executor;
    private final int pageSize;
    private final int maxPages;
    private final Counter pagesCounter;
    private final Counter truncatedCounter;

    public PaginatedFetcher(
            UpstreamClient client,
            ExecutorService executor,
            int pageSize,
            int maxPages,
            MeterRegistry meterRegistry) {
        if (maxPages <= 0) {
            throw new IllegalArgumentException("maxPages must be positive");
        }
        this.client = client;
        this.executor = executor;
        this.pageSize = pageSize;
        this.maxPages = maxPages;
        this.pagesCounter = Counter.builder("fetch.upstream.pages")
            .description("Upstream pages consumed")
            .register(meterRegistry);
        this.truncatedCounter = Counter.builder("fetch.upstream.truncated")
            .description("Fetches stopped by the page ceiling")
            .register(meterRegistry);
    }

    public FetchResult fetchAll(String site, List<String> points, Instant start, Instant end, Duration timeout) {
        return fetchAll(site, points, start, end, timeout, ProgressListener.NONE);
    }

    public FetchResult fetchAll(
            String site,
            List<String> points,
            Instant start,
            Instant end,
            Duration timeout,
            ProgressListener listener) {

        TimeLimiter timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
            .timeoutDuration(timeout)
            .cancelRunningFuture(true)
            .build());

        try {
            return timeLimiter.executeFutureSupplier(
                () -> executor.submit(() -> paginate(site, points, start, end, listener)));
        } catch (TimeoutException e) {
            log.warn("Fetch deadline of {} exceeded for site={}, points={}", timeout, site, points.size());
            throw new UpstreamTimeoutException(
                String.format("Upstream fetch for site %s exceeded %d ms", site, timeout.toMillis()), e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamTimeoutException("Upstream fetch interrupted for site " + site, e);
        } catch (FetchException e) {
            throw e;
        } catch (Exception e) {
            throw unwrap(e);
        }
    }

    FetchResult paginate(String site, List<String> points, Instant start, Instant end, ProgressListener listener) {
        Set<String> requested = new LinkedHashSet<>(points);
        Map<String, List<Sample>> collected = new LinkedHashMap<>();
        PageQuery query = new PageQuery(site, start, end, points, null, pageSize);

        int page = 0;
        boolean more;
        boolean truncated = false;
        do {
            if (Thread.currentThread().isInterrupted()) {
                throw new UpstreamTimeoutException("Upstream fetch cancelled after " + page + " pages");
            }
            page++;
            UpstreamPage response = client.fetchPage(query);
            pagesCounter.increment();

            for (UpstreamPage.UpstreamSample sample : response.pointSamples()) {
                if (sample.name() != null && requested.contains(sample.name())) {
                    collected.computeIfAbsent(sample.name(), name -> new ArrayList<>())
                        .add(new Sample(sample.time(), sample.value()));
                }
            }

            more = response.continues();
            if (more && page >= maxPages) {
                truncated = true;
                truncatedCounter.increment();
                log.warn("Page ceiling of {} reached for site={}; result truncated", maxPages, site);
                more = false;
            }

            listener.onProgress(more ? Math.min(90, page * 10) : 100, collected.size(), requested.size());
            if (more) {
                query = query.withCursor(response.nextCursor());
            }
        } while (more);

        Map<String, PointSeries> data = new LinkedHashMap<>();
        for (String point : requested) {
            List<Sample> samples = collected.get(point);
            if (samples != null) {
                data.put(point, PointSeries.of(samples));
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Fetched {} pages for site={}, {} of {} points returned data",
                page, site, data.size(), requested.size());
        }
        return new FetchResult(data, page, truncated);
    }

    private static FetchException unwrap(Throwable error) {
        if (error instanceof FetchException fetchException) {
            return fetchException;
        }
        String message = error != null && error.getMessage() != null ? error.getMessage() : "Upstream fetch failed";
        return new UpstreamException(message, ErrorCategory.UNKNOWN, error);
    }
}
