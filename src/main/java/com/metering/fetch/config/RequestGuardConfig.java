package com.metering.fetch.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Locale;
import java.util.UUID;

/**
 * Request safety configuration.
 *
 * Rejects path traversal attempts, tags every request with a request id (MDC key
 * {@code requestId}, echoed in the {@code X-Request-Id} header) and logs exceptions
 * that escaped the exception handlers.
 */
@Configuration
public class RequestGuardConfig implements WebMvcConfigurer {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String REQUEST_ID_MDC_KEY = "requestId";

    public static String newRequestId() {
        return "req_" + UUID.randomUUID().toString().replace("-", "");
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new RequestGuardInterceptor());
    }

    public static class RequestGuardInterceptor implements HandlerInterceptor {

        private static final Logger log = LoggerFactory.getLogger(RequestGuardInterceptor.class);

        @Override
        public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
            String uri = request.getRequestURI();
            if (uri.contains("..") || uri.toLowerCase(Locale.ROOT).contains("%2e%2e")) {
                log.warn("Path traversal attempt rejected: {}", uri);
                response.setStatus(HttpStatus.BAD_REQUEST.value());
                return false;
            }

            String requestId = request.getHeader(REQUEST_ID_HEADER);
            if (requestId == null || requestId.isBlank() || requestId.length() > 64) {
                requestId = newRequestId();
            }
            MDC.put(REQUEST_ID_MDC_KEY, requestId);
            request.setAttribute(REQUEST_ID_MDC_KEY, requestId);
            response.setHeader(REQUEST_ID_HEADER, requestId);
            return true;
        }

        @Override
        public void afterCompletion(
                HttpServletRequest request,
                HttpServletResponse response,
                Object handler,
                Exception ex) {
            if (ex != null) {
                log.error("Uncaught exception in request {}: {}", request.getRequestURI(), ex.getMessage(), ex);
            }
            MDC.remove(REQUEST_ID_MDC_KEY);
        }
    }
}
