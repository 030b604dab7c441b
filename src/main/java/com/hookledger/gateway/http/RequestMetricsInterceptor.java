package com.hookledger.gateway.http;

import com.hookledger.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.time.Duration;
import java.util.Locale;
import java.util.UUID;

/**
 * Tags every request with an id, then records its status and latency once the
 * response is complete. Paths are recorded by route pattern to bound label values.
 */
public class RequestMetricsInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RequestMetricsInterceptor.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String UNMATCHED = "unmatched";
    private static final String REQUEST_ID = "request_id";
    private static final String START_NANOS = RequestMetricsInterceptor.class.getName() + ".start";

    private final MetricsRegistry metrics;

    public RequestMetricsInterceptor(MetricsRegistry metrics) {
        this.metrics = metrics;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        var requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank() || requestId.length() > 128) {
            requestId = UUID.randomUUID().toString();
        }
        request.setAttribute(START_NANOS, System.nanoTime());
        MDC.put(REQUEST_ID, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        try {
            var start = request.getAttribute(START_NANOS);
            if (!(start instanceof Long startNanos)) return;

            var latency = Duration.ofNanos(System.nanoTime() - startNanos);
            var endpoint = endpointOf(request);
            int status = response.getStatus();
            metrics.recordRequest(endpoint, status, latency);

            try (var ignoredMethod = MDC.putCloseable("method", request.getMethod());
                 var ignoredPath = MDC.putCloseable("path", request.getRequestURI());
                 var ignoredStatus = MDC.putCloseable("status", String.valueOf(status));
                 var ignoredLatency = MDC.putCloseable("latency_ms", String.format(Locale.ROOT, "%.2f", latency.toNanos() / 1_000_000.0))) {
                log.info("{} {} {}", request.getMethod(), request.getRequestURI(), status);
            }
        } finally {
            MDC.remove(REQUEST_ID);
        }
    }

    static String endpointOf(HttpServletRequest request) {
        var pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern != null ? pattern.toString() : UNMATCHED;
    }
}
