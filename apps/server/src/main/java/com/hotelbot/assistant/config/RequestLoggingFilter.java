package com.hotelbot.assistant.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * One line per request with method, path, status and latency. The trace id is echoed in
 * {@code X-Trace-Id} and put in the MDC for every log line of the request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

    static final String HEADER_TRACE_ID = "X-Trace-Id";
    static final String MDC_TRACE_ID = "traceId";

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return "/api/v1/health".equals(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = request.getHeader(HEADER_TRACE_ID);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString().replace("-", "");
        } else {
            traceId = traceId.trim();
        }
        response.setHeader(HEADER_TRACE_ID, traceId);
        MDC.put(MDC_TRACE_ID, traceId);

        long startNs = System.nanoTime();
        Throwable error = null;
        try {
            filterChain.doFilter(request, response);
        } catch (ServletException | IOException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            if (error == null) {
                log.info("HTTP method={}, path={}, status={}, costMs={}",
                        request.getMethod(), request.getRequestURI(), response.getStatus(), costMs);
            } else {
                log.warn("HTTP method={}, path={}, status={}, costMs={}, errorType={}",
                        request.getMethod(), request.getRequestURI(), response.getStatus(), costMs,
                        error.getClass().getSimpleName());
            }
            MDC.remove(MDC_TRACE_ID);
        }
    }
}
