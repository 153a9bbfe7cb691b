package com.askql.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts the request's trace id into the logging MDC and echoes it back.
 *
 * <p>A client-supplied {@code X-Request-Id} is reused when it is short and printable; otherwise a
 * random UUID is generated.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String TRACE_ID_HEADER = "X-Request-Id";
    public static final String MDC_TRACE_ID = "trace_id";

    private static final int MAX_TRACE_ID_LENGTH = 128;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(TRACE_ID_HEADER));
        MDC.put(MDC_TRACE_ID, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE_ID);
        }
    }

    static String resolveTraceId(String header) {
        if (header == null) {
            return UUID.randomUUID().toString();
        }
        String v = header.trim();
        if (v.isEmpty() || v.length() > MAX_TRACE_ID_LENGTH || !v.chars().allMatch(c -> c > 0x20 && c < 0x7f)) {
            return UUID.randomUUID().toString();
        }
        return v;
    }
}
