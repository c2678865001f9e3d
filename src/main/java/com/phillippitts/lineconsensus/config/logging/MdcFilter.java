package com.phillippitts.lineconsensus.config.logging;

import com.phillippitts.lineconsensus.util.LogSanitizer;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Binds the correlation ids of a reduction request to the Log4j2 ThreadContext.
 *
 * <p>{@code requestId} comes from {@code X-Request-ID} (or a fresh UUID) and is echoed on the
 * response so a crowd project's tooling can match its batch to the server log. {@code projectId}
 * names the crowd project whose classifications are being reduced; it is printed on every log line
 * and copied onto reduction events. Both are caller-supplied, so they are restricted to
 * {@code [A-Za-z0-9._-]} and capped in length before they reach the log.
 *
 * <p>The context is cleared after the request so pooled servlet threads never carry a previous
 * request's ids. Reduction workers receive a copy through the executor's task decorator.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String PROJECT_ID_HEADER = "X-Project-ID";
    static final int MAX_ID_LENGTH = 64;

    private static final Pattern UNSAFE_ID_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                bind(http, response);
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static void bind(HttpServletRequest request, ServletResponse response) {
        String requestId = sanitizeId(request.getHeader(REQUEST_ID_HEADER));
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        ThreadContext.put("requestId", requestId);
        if (response instanceof HttpServletResponse http) {
            http.setHeader(REQUEST_ID_HEADER, requestId);
        }

        String projectId = sanitizeId(request.getHeader(PROJECT_ID_HEADER));
        if (projectId != null) {
            ThreadContext.put("projectId", projectId);
        }
        ThreadContext.put("method", request.getMethod());
        ThreadContext.put("uri", request.getRequestURI());
    }

    /**
     * @return the id with unsafe characters removed and capped at {@link #MAX_ID_LENGTH}, or null
     *         when nothing usable is left
     */
    static String sanitizeId(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = LogSanitizer.truncate(UNSAFE_ID_CHARS.matcher(raw.strip()).replaceAll(""), MAX_ID_LENGTH);
        return cleaned.isEmpty() ? null : cleaned;
    }
}
