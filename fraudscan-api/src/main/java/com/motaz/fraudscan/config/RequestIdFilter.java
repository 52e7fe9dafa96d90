package com.motaz.fraudscan.config;

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
import java.util.regex.Pattern;

/**
 * Tags every log line of a request with a {@code trace_id} and the calling
 * user. The trace id comes from {@code X-Request-ID} when the client sends
 * a usable one and is echoed back on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    static final String TRACE_KEY = "trace_id";
    static final String USER_KEY = "user_id";
    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String USER_HEADER = "X-User-Id";

    // ids end up in log lines, keep them short and free of separators
    private static final Pattern USABLE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String traceId = traceIdFor(request.getHeader(REQUEST_ID_HEADER));
        response.setHeader(REQUEST_ID_HEADER, traceId);
        MDC.put(TRACE_KEY, traceId);

        String userId = request.getHeader(USER_HEADER);
        if (userId != null && USABLE_ID.matcher(userId).matches()) {
            MDC.put(USER_KEY, userId);
        }
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(TRACE_KEY);
            MDC.remove(USER_KEY);
        }
    }

    static String traceIdFor(String requested) {
        if (requested != null && USABLE_ID.matcher(requested).matches()) {
            return requested;
        }
        return UUID.randomUUID().toString();
    }
}
