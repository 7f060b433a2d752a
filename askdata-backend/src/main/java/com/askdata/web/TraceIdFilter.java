package com.askdata.web;

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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Puts the request's trace id and, when the request names one, its session id into the MDC.
 *
 * <p>The trace id comes from {@code X-Request-Id} when that header is a plain token, otherwise a
 * new one is generated; either way it is echoed back on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(TraceIdFilter.class);

    public static final String TRACE_ID_HEADER = "X-Request-Id";
    public static final String MDC_TRACE_ID = "trace_id";
    public static final String MDC_SESSION_ID = "session_id";

    static final int MAX_TRACE_ID_LENGTH = 64;

    private static final Pattern TRACE_ID_CHARS = Pattern.compile("[A-Za-z0-9._-]+");
    private static final Pattern SESSION_PATH = Pattern.compile("^/v1/sessions/([^/]+)/dataset$");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String traceId = acceptTraceId(request.getHeader(TRACE_ID_HEADER));
        MDC.put(MDC_TRACE_ID, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        String sessionId = sessionIdOf(request);
        if (sessionId != null) {
            MDC.put(MDC_SESSION_ID, sessionId);
        }

        long started = System.nanoTime();
        try {
            chain.doFilter(request, response);
        } finally {
            if (log.isDebugEnabled()) {
                log.debug("Request finished: method={}, path={}, status={}, duration_ms={}",
                        request.getMethod(), request.getRequestURI(), response.getStatus(),
                        (System.nanoTime() - started) / 1_000_000);
            }
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(MDC_SESSION_ID);
        }
    }

    static String acceptTraceId(String header) {
        if (header == null) {
            return UUID.randomUUID().toString();
        }
        String candidate = header.trim();
        if (candidate.isEmpty() || candidate.length() > MAX_TRACE_ID_LENGTH
                || !TRACE_ID_CHARS.matcher(candidate).matches()) {
            return UUID.randomUUID().toString();
        }
        return candidate;
    }

    static String sessionIdOf(HttpServletRequest request) {
        String param = request.getParameter(MDC_SESSION_ID);
        if (param != null && !param.isBlank()) {
            return param.trim();
        }
        String path = request.getRequestURI();
        if (path == null) {
            return null;
        }
        Matcher m = SESSION_PATH.matcher(path);
        return m.matches() ? m.group(1) : null;
    }
}
