package com.metering.fetch.upstream;

import com.metering.fetch.domain.ErrorCategory;
import com.metering.fetch.exception.UpstreamException;
import com.metering.fetch.exception.UpstreamTimeoutException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * {@link UpstreamClient} over Spring's {@link RestClient}, guarded by the
 * {@code upstream} circuit breaker.
 */
public class RestUpstreamClient implements UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(RestUpstreamClient.class);

    static final String PAGINATED_PATH = "/sites/{site}/timeseries/paginated";

    private final RestClient restClient;
    private final CircuitBreaker circuitBreaker;

    public RestUpstreamClient(RestClient restClient, CircuitBreakerRegistry circuitBreakerRegistry) {
        this.restClient = restClient;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("upstream");

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Upstream circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    @Override
    public UpstreamPage fetchPage(PageQuery query) {
        try {
            return circuitBreaker.executeSupplier(() -> requestPage(query));
        } catch (CallNotPermittedException e) {
            log.error("Upstream circuit breaker OPEN - rejecting page request for site={}", query.site());
            throw new UpstreamException("Upstream circuit breaker is open", ErrorCategory.TRANSIENT, e);
        }
    }

    public CircuitBreaker.State circuitState() {
        return circuitBreaker.getState();
    }

    private UpstreamPage requestPage(PageQuery query) {
        try {
            UpstreamPage page = restClient.get()
                .uri(builder -> {
                    builder.path(PAGINATED_PATH)
                        .queryParam("start_time", query.start().toString())
                        .queryParam("end_time", query.end().toString())
                        .queryParam("raw_data", "true")
                        .queryParam("page_size", query.pageSize());
                    if (!query.pointNames().isEmpty()) {
                        builder.queryParam("point_names", String.join(",", query.pointNames()));
                    }
                    if (query.cursor() != null) {
                        builder.queryParam("cursor", query.cursor());
                    }
                    return builder.build(query.site());
                })
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw UpstreamException.forStatus(response.getStatusCode().value(), response.getStatusText());
                })
                .body(UpstreamPage.class);

            if (page == null) {
                throw new UpstreamException("Upstream returned an empty body", ErrorCategory.SERVER_FAULT, 0);
            }
            return page;

        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                throw new UpstreamTimeoutException("Upstream request timed out for site " + query.site(), e);
            }
            throw new UpstreamException("Upstream unreachable: " + e.getMessage(), ErrorCategory.TRANSIENT, e);
        } catch (UpstreamException e) {
            throw e;
        } catch (RestClientException e) {
            throw new UpstreamException("Malformed upstream response: " + e.getMessage(), ErrorCategory.SERVER_FAULT, e);
        }
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
