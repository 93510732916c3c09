package com.fedsearch.web;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns every request a trace id and keeps it in the MDC as {@code trace_id} while the request
 * runs. Search path tasks copy the MDC, so their log lines and every {@code trace_id} field in a
 * response body carry the same id.
 *
 * <p>The id is taken from {@code X-Request-Id}, else from the trace-id field of a W3C
 * {@code traceparent} header, else generated. Caller-supplied ids that are too long or contain
 * characters outside {@code [A-Za-z0-9._:-]} are replaced, so they cannot forge log lines.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter implements Filter {

    static final String TRACE_ID_HEADER = "X-Request-Id";
    static final String TRACEPARENT_HEADER = "traceparent";
    static final String MDC_TRACE_ID = "trace_id";

    private static final Pattern SAFE_TRACE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");
    // version-traceid-parentid-flags
    private static final Pattern TRACEPARENT = Pattern.compile("[0-9a-f]{2}-([0-9a-f]{32})-[0-9a-f]{16}-[0-9a-f]{2}");
    private static final String INVALID_TRACE_ID = "00000000000000000000000000000000";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (request instanceof HttpServletRequest httpServletRequest) {
            String traceId = resolveTraceId(httpServletRequest);
            MDC.put(MDC_TRACE_ID, traceId);

            if (response instanceof HttpServletResponse httpServletResponse) {
                httpServletResponse.setHeader(TRACE_ID_HEADER, traceId);
            }
        }

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE_ID);
        }
    }

    static String resolveTraceId(HttpServletRequest request) {
        String requestId = request.getHeader(TRACE_ID_HEADER);
        if (requestId != null && SAFE_TRACE_ID.matcher(requestId.trim()).matches()) {
            return requestId.trim();
        }
        String traceparent = request.getHeader(TRACEPARENT_HEADER);
        if (traceparent != null) {
            Matcher matcher = TRACEPARENT.matcher(traceparent.trim());
            if (matcher.matches() && !INVALID_TRACE_ID.equals(matcher.group(1))) {
                return matcher.group(1);
            }
        }
        return UUID.randomUUID().toString();
    }
}
