package com.phillippitts.axiom.config.logging;

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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Puts request correlation keys into Log4j2's ThreadContext for the duration of an HTTP request.
 *
 * <ul>
 *   <li>requestId: the client's X-Request-ID when it is a safe token, otherwise a new UUID;
 *       always echoed back in the response</li>
 *   <li>sessionId: taken from {@code /api/sessions/{sessionId}/...} paths</li>
 *   <li>method, uri</li>
 * </ul>
 *
 * <p>The turn executor copies these keys onto the turn thread, where the orchestrator adds turnId.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    /** Client ids end up in every log line of the request, so only short plain tokens are kept. */
    private static final Pattern SAFE_REQUEST_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    private static final Pattern SESSION_PATH = Pattern.compile("^/api/sessions/([^/]+)");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = requestId(http.getHeader(REQUEST_ID_HEADER));
                ThreadContext.put("requestId", requestId);
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
                String sessionId = sessionId(http.getRequestURI());
                if (sessionId != null) {
                    ThreadContext.put("sessionId", sessionId);
                }
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    static String requestId(String header) {
        if (header != null && SAFE_REQUEST_ID.matcher(header).matches()) {
            return header;
        }
        return UUID.randomUUID().toString();
    }

    static String sessionId(String uri) {
        if (uri == null) {
            return null;
        }
        Matcher m = SESSION_PATH.matcher(uri);
        return m.find() ? m.group(1) : null;
    }
}
